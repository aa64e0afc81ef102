package io.reviewdeck.core.deck.poi;

import io.reviewdeck.core.template.Tokens;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.geom.Rectangle2D;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.poi.sl.usermodel.ShapeType;
import org.apache.poi.sl.usermodel.TextParagraph.TextAlign;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFAutoShape;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFShapeContainer;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;

public final class MasterTemplateBuilder {
    public static final String DEFAULT_FILE_NAME = "Master_QBR_Template.pptx";
    public static final Rectangle2D CHART_SLOT = new Rectangle2D.Double(54, 166, 612, 238);

    private static final int INCH = 72;
    private static final Color BLUE = new Color(46, 92, 138);
    private static final Color GRAY = new Color(74, 85, 104);
    private static final Color LIGHT_GRAY = new Color(226, 232, 240);
    private static final Color GREEN = new Color(34, 197, 94);
    private static final Color RED = new Color(239, 68, 68);

    public XMLSlideShow build() {
        XMLSlideShow ppt = new XMLSlideShow();
        ppt.setPageSize(new Dimension(10 * INCH, (int) (7.5 * INCH)));
        addTitleSlide(ppt.createSlide());
        addExecutiveSummary(ppt.createSlide());
        addMetricsOverview(ppt.createSlide());
        addChartSlide(ppt.createSlide());
        addStabilitySlide(ppt.createSlide());
        addSlaSlide(ppt.createSlide());
        addRecommendations(ppt.createSlide());
        addThankYou(ppt.createSlide());
        return ppt;
    }

    public byte[] toBytes() throws IOException {
        try (XMLSlideShow ppt = build(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ppt.write(out);
            return out.toByteArray();
        }
    }

    public Path write(Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        try (XMLSlideShow ppt = build(); OutputStream out = Files.newOutputStream(target)) {
            ppt.write(out);
        }
        return target;
    }

    private void addTitleSlide(XSLFSlide slide) {
        text(slide, rect(1, 2.5, 8, 1), "Quarterly Business Review", 48, true, BLUE, TextAlign.CENTER);
        text(slide, rect(1, 3.7, 8, 0.8), Tokens.delimited(Tokens.CLIENT_NAME), 32, false, GRAY, TextAlign.CENTER);
        text(slide, rect(1, 6, 8, 0.5), Tokens.delimited(Tokens.REVIEW_PERIOD), 20, false, GRAY, TextAlign.CENTER);
    }

    private void addExecutiveSummary(XSLFSlide slide) {
        heading(slide, "Executive Summary", 40);
        bullets(slide, rect(1, 2, 8, 4), List.of(
            "We handled {{TICKET_COUNT}} service requests this period",
            "{{SAME_DAY_RATE}}% of closed tickets were resolved the same day",
            "Average time to first response: {{AVG_FIRST_RESPONSE}}"
        ), 24);
    }

    private void addMetricsOverview(XSLFSlide slide) {
        heading(slide, "Service Delivery Metrics", 40);
        String[][] cards = {
            {"Total Tickets", "{{TICKET_COUNT}}"},
            {"Same-Day Resolution", "{{SAME_DAY_RATE}}%"},
            {"First Response", "{{AVG_FIRST_RESPONSE}}"}
        };
        double[] xPositions = {1, 3.7, 6.4};
        for (int i = 0; i < cards.length; i++) {
            XSLFAutoShape card = slide.createAutoShape();
            card.setShapeType(ShapeType.RECT);
            card.setAnchor(rect(xPositions[i], 2.5, 2.2, 2.5));
            card.setFillColor(LIGHT_GRAY);
            card.setLineColor(BLUE);
            text(slide, rect(xPositions[i], 2.7, 2.2, 0.8), cards[i][0], 14, false, GRAY, TextAlign.CENTER);
            text(slide, rect(xPositions[i], 3.5, 2.2, 1), cards[i][1], 28, true, BLUE, TextAlign.CENTER);
        }
    }

    private void addChartSlide(XSLFSlide slide) {
        heading(slide, "Service Type Distribution", 40);
        text(slide, rect(0.5, 1.3, 9, 0.4), "Proactive vs Reactive Support", 20, false, GRAY, TextAlign.LEFT);
        XSLFAutoShape frame = slide.createAutoShape();
        frame.setShapeType(ShapeType.RECT);
        frame.setAnchor(CHART_SLOT);
        frame.setFillColor(new Color(240, 240, 240));
        frame.setLineColor(GRAY);
        text(slide, CHART_SLOT, Tokens.delimited(Tokens.CHART_PLACEHOLDER), 24, false, GRAY, TextAlign.CENTER);
    }

    private void addStabilitySlide(XSLFSlide slide) {
        heading(slide, "Service Stability & Proactive Maintenance", 36);
        colouredBox(slide, rect(1, 2.5, 3.5, 2), GREEN, "Proactive Work", "{{PROACTIVE_PERCENT}}%");
        colouredBox(slide, rect(5.5, 2.5, 3.5, 2), RED, "Reactive Issues", "{{REACTIVE_PERCENT}}%");
        text(
            slide,
            rect(1, 5.5, 8, 1),
            "A higher proactive percentage indicates better preventive maintenance and system monitoring.",
            16,
            false,
            GRAY,
            TextAlign.CENTER
        );
    }

    private void addSlaSlide(XSLFSlide slide) {
        heading(slide, "SLA Performance & Response Times", 36);
        String[][] rows = {
            {"Measure", "Result"},
            {"Tickets Handled", "{{TICKET_COUNT}}"},
            {"Same-Day Resolution Rate", "{{SAME_DAY_RATE}}%"},
            {"Average First Response", "{{AVG_FIRST_RESPONSE}}"},
            {"Critical Issue Resolution", "{{CRITICAL_RES_TIME}}"}
        };
        XSLFTable table = slide.createTable();
        table.setAnchor(rect(1.5, 2.2, 7, 3.5));
        for (int r = 0; r < rows.length; r++) {
            XSLFTableRow row = table.addRow();
            row.setHeight(0.6 * INCH);
            for (String value : rows[r]) {
                XSLFTableCell cell = row.addCell();
                XSLFTextRun run = cell.setText(value);
                run.setFontSize(r == 0 ? 20.0 : 18.0);
                run.setBold(r == 0);
                run.setFontColor(r == 0 ? Color.WHITE : GRAY);
                cell.setFillColor(r == 0 ? BLUE : LIGHT_GRAY);
            }
        }
        table.setColumnWidth(0, 4.2 * INCH);
        table.setColumnWidth(1, 2.8 * INCH);
    }

    private void addRecommendations(XSLFSlide slide) {
        heading(slide, "Strategic Recommendations", 40);
        double[] yPositions = {2, 3.5, 5};
        for (int i = 0; i < yPositions.length; i++) {
            Rectangle2D area = rect(1.2, yPositions[i], 7.3, 0.8);
            XSLFGroupShape group = slide.createGroup();
            group.setAnchor(area);
            group.setInteriorAnchor(area);

            XSLFAutoShape badge = group.createAutoShape();
            badge.setShapeType(ShapeType.ELLIPSE);
            badge.setAnchor(rect(1.2, yPositions[i], 0.5, 0.5));
            badge.setFillColor(BLUE);
            text(group, rect(1.2, yPositions[i], 0.5, 0.5), String.valueOf(i + 1), 24, true, Color.WHITE, TextAlign.CENTER);
            text(
                group,
                rect(2, yPositions[i], 6.5, 0.8),
                Tokens.delimited(Tokens.recommendation(i + 1)),
                18,
                false,
                GRAY,
                TextAlign.LEFT
            );
        }
    }

    private void addThankYou(XSLFSlide slide) {
        text(slide, rect(1, 2.5, 8, 1), "Thank You", 48, true, BLUE, TextAlign.CENTER);
        text(slide, rect(1, 4, 8, 0.6), "Questions? Contact your account manager", 22, false, GRAY, TextAlign.CENTER);
        text(slide, rect(1, 5, 8, 1), Tokens.delimited(Tokens.MSP_CONTACT_INFO), 18, false, GRAY, TextAlign.CENTER);
    }

    private void heading(XSLFSlide slide, String title, double size) {
        text(slide, rect(0.5, 0.5, 9, 0.8), title, size, true, BLUE, TextAlign.LEFT);
    }

    private void colouredBox(XSLFSlide slide, Rectangle2D area, Color fill, String label, String value) {
        XSLFAutoShape box = slide.createAutoShape();
        box.setShapeType(ShapeType.RECT);
        box.setAnchor(area);
        box.setFillColor(fill);
        Rectangle2D inner = new Rectangle2D.Double(area.getX(), area.getY() + 0.2 * INCH, area.getWidth(), 1.5 * INCH);
        XSLFTextBox textBox = slide.createTextBox();
        textBox.setAnchor(inner);
        textBox.clearText();
        paragraph(textBox, label, 28, true, Color.WHITE, TextAlign.CENTER);
        paragraph(textBox, value, 28, true, Color.WHITE, TextAlign.CENTER);
    }

    private void bullets(XSLFSlide slide, Rectangle2D area, List<String> lines, double size) {
        XSLFTextBox box = slide.createTextBox();
        box.setAnchor(area);
        box.setWordWrap(true);
        box.clearText();
        for (String line : lines) {
            XSLFTextParagraph paragraph = paragraph(box, "• " + line, size, false, GRAY, TextAlign.LEFT);
            paragraph.setSpaceAfter(20.0);
        }
    }

    private XSLFTextBox text(
        XSLFShapeContainer container,
        Rectangle2D area,
        String value,
        double size,
        boolean bold,
        Color color,
        TextAlign align
    ) {
        XSLFTextBox box = container.createTextBox();
        box.setAnchor(area);
        box.setWordWrap(true);
        box.clearText();
        paragraph(box, value, size, bold, color, align);
        return box;
    }

    private XSLFTextParagraph paragraph(XSLFTextBox box, String value, double size, boolean bold, Color color, TextAlign align) {
        XSLFTextParagraph paragraph = box.addNewTextParagraph();
        paragraph.setTextAlign(align);
        XSLFTextRun run = paragraph.addNewTextRun();
        run.setText(value);
        run.setFontSize(size);
        run.setBold(bold);
        run.setFontColor(color);
        return paragraph;
    }

    private static Rectangle2D rect(double x, double y, double width, double height) {
        return new Rectangle2D.Double(x * INCH, y * INCH, width * INCH, height * INCH);
    }
}
