package io.reviewdeck.core.chart;

import java.awt.AWTError;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ChartRenderer {
    private static final Logger LOG = LoggerFactory.getLogger(ChartRenderer.class);

    static final int WIDTH = 1350;
    static final int HEIGHT = 525;
    static final int BAR_LEFT = 90;
    static final int BAR_RIGHT = WIDTH - 90;
    static final int BAR_TOP = 150;
    static final int BAR_HEIGHT = 150;
    static final int MIN_LABELLED_SHARE = 10;

    static final Color PROACTIVE_COLOR = new Color(0x22C55E);
    static final Color REACTIVE_COLOR = new Color(0xEF4444);
    private static final Color TITLE_COLOR = new Color(0x2E5C8A);
    private static final Color AXIS_COLOR = new Color(0x4A5568);

    public ChartImage render(double proactivePct, double reactivePct) {
        Split split = Split.of(proactivePct, reactivePct);
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, WIDTH, HEIGHT);

            drawSegments(graphics, split);
            drawAxis(graphics);
            drawText(graphics, split);
        } finally {
            graphics.dispose();
        }
        return new ChartImage(writePng(image), WIDTH, HEIGHT);
    }

    List<String> segmentLabels(double proactivePct, double reactivePct) {
        Split split = Split.of(proactivePct, reactivePct);
        List<String> labels = new ArrayList<>();
        if (split.proactive() >= MIN_LABELLED_SHARE) {
            labels.add(percentLabel(split.proactive()));
        }
        if (split.reactive() >= MIN_LABELLED_SHARE) {
            labels.add(percentLabel(split.reactive()));
        }
        return labels;
    }

    static int scaleX(double pct) {
        return BAR_LEFT + (int) Math.round((BAR_RIGHT - BAR_LEFT) * Math.max(0, Math.min(100, pct)) / 100.0);
    }

    private void drawSegments(Graphics2D graphics, Split split) {
        int proactiveEnd = scaleX(split.proactive());
        int reactiveEnd = scaleX(split.proactive() + split.reactive());
        graphics.setColor(PROACTIVE_COLOR);
        graphics.fillRect(BAR_LEFT, BAR_TOP, proactiveEnd - BAR_LEFT, BAR_HEIGHT);
        graphics.setColor(REACTIVE_COLOR);
        graphics.fillRect(proactiveEnd, BAR_TOP, reactiveEnd - proactiveEnd, BAR_HEIGHT);
    }

    private void drawAxis(Graphics2D graphics) {
        int axisY = BAR_TOP + BAR_HEIGHT + 20;
        graphics.setColor(AXIS_COLOR);
        graphics.setStroke(new BasicStroke(1.5f));
        graphics.drawLine(BAR_LEFT, axisY, BAR_RIGHT, axisY);
        for (int tick = 0; tick <= 100; tick += 20) {
            int x = scaleX(tick);
            graphics.drawLine(x, axisY, x, axisY + 8);
        }
    }

    private void drawText(Graphics2D graphics, Split split) {
        drawGuarded(() -> {
            drawTitle(graphics);
            drawSegmentLabels(graphics, split);
            drawTickLabels(graphics);
            drawLegend(graphics, split);
        });
    }

    // Glyph rendering needs the platform font stack; a headless host without fonts still gets the bars.
    static boolean drawGuarded(Runnable textPass) {
        try {
            textPass.run();
            return true;
        } catch (RuntimeException | AWTError e) {
            LOG.warn("Chart text skipped, font subsystem unavailable: {}", e.toString());
            return false;
        }
    }

    private void drawTitle(Graphics2D graphics) {
        graphics.setFont(new Font("SansSerif", Font.BOLD, 30));
        graphics.setColor(TITLE_COLOR);
        drawCentered(graphics, "Proactive vs. Reactive Support Distribution", WIDTH / 2, 80);
    }

    private void drawSegmentLabels(Graphics2D graphics, Split split) {
        graphics.setFont(new Font("SansSerif", Font.BOLD, 38));
        graphics.setColor(Color.WHITE);
        int baseline = BAR_TOP + BAR_HEIGHT / 2 + graphics.getFontMetrics().getAscent() / 2 - 4;
        if (split.proactive() >= MIN_LABELLED_SHARE) {
            int center = (BAR_LEFT + scaleX(split.proactive())) / 2;
            drawCentered(graphics, percentLabel(split.proactive()), center, baseline);
        }
        if (split.reactive() >= MIN_LABELLED_SHARE) {
            int start = scaleX(split.proactive());
            int center = (start + scaleX(split.proactive() + split.reactive())) / 2;
            drawCentered(graphics, percentLabel(split.reactive()), center, baseline);
        }
    }

    private void drawTickLabels(Graphics2D graphics) {
        graphics.setFont(new Font("SansSerif", Font.PLAIN, 20));
        graphics.setColor(AXIS_COLOR);
        int baseline = BAR_TOP + BAR_HEIGHT + 55;
        for (int tick = 0; tick <= 100; tick += 20) {
            drawCentered(graphics, String.valueOf(tick), scaleX(tick), baseline);
        }
        drawCentered(graphics, "Percentage of Total Tickets (%)", WIDTH / 2, baseline + 35);
    }

    private void drawLegend(Graphics2D graphics, Split split) {
        graphics.setFont(new Font("SansSerif", Font.PLAIN, 22));
        int y = HEIGHT - 45;
        int x = WIDTH / 2 - 260;
        x = drawLegendEntry(graphics, x, y, PROACTIVE_COLOR, "Proactive (" + percentLabel(split.proactive()) + ")");
        drawLegendEntry(graphics, x + 60, y, REACTIVE_COLOR, "Reactive (" + percentLabel(split.reactive()) + ")");
    }

    private int drawLegendEntry(Graphics2D graphics, int x, int y, Color color, String label) {
        graphics.setColor(color);
        graphics.fillRect(x, y - 18, 22, 22);
        graphics.setColor(AXIS_COLOR);
        graphics.drawString(label, x + 32, y);
        return x + 32 + graphics.getFontMetrics().stringWidth(label);
    }

    private void drawCentered(Graphics2D graphics, String text, int centerX, int baseline) {
        FontMetrics metrics = graphics.getFontMetrics();
        graphics.drawString(text, centerX - metrics.stringWidth(text) / 2, baseline);
    }

    private static String percentLabel(double pct) {
        return (int) pct + "%";
    }

    private byte[] writePng(BufferedImage image) {
        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", outputStream);
            return outputStream.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode chart image", e);
        }
    }

    private record Split(double proactive, double reactive) {
        static Split of(double proactive, double reactive) {
            if (proactive == 0 && reactive == 0) {
                return new Split(50, 50);
            }
            return new Split(proactive, reactive);
        }
    }
}
