package io.reviewdeck.core.template;

import io.reviewdeck.core.chart.ChartImage;
import io.reviewdeck.core.chart.ChartRenderer;
import io.reviewdeck.core.deck.Deck;
import io.reviewdeck.core.deck.DeckLoader;
import io.reviewdeck.core.deck.DeckShape;
import io.reviewdeck.core.deck.DeckSlide;
import io.reviewdeck.core.deck.TextUnit;
import io.reviewdeck.core.deck.TextVisitor;
import io.reviewdeck.core.metrics.MetricsAggregator;
import io.reviewdeck.core.metrics.MetricsResult;
import io.reviewdeck.core.ticket.TicketRecord;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DocumentComposer {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentComposer.class);
    private static final String CHART_TOKEN = Tokens.delimited(Tokens.CHART_PLACEHOLDER);

    private final DeckLoader loader;
    private final MetricsAggregator aggregator;
    private final ChartRenderer chartRenderer;
    private final PlaceholderResolver resolver;

    public DocumentComposer(
        DeckLoader loader,
        MetricsAggregator aggregator,
        ChartRenderer chartRenderer,
        PlaceholderResolver resolver
    ) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.chartRenderer = Objects.requireNonNull(chartRenderer, "chartRenderer must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    public byte[] compose(Path template, Map<String, String> contextTokens, List<TicketRecord> tickets) throws IOException {
        Objects.requireNonNull(template, "template must not be null");
        MetricsResult metrics = aggregator.aggregate(tickets);
        ChartImage chart = chartRenderer.render(metrics.proactivePct(), metrics.reactivePct());

        TokenMap tokens = TokenMap.of(contextTokens)
            .merge(metrics.asTokens())
            .without(Tokens.CHART_PLACEHOLDER);
        List<String> missing = TokenValidator.missing(tokens, TokenValidator.CONTEXT_TOKENS);
        if (!missing.isEmpty()) {
            LOG.warn("No value supplied for tokens {}; they stay literal in the deck", missing);
        }

        try (Deck deck = loader.open(template)) {
            int slidesModified = 0;
            int shapesReplaced = 0;
            List<DeckSlide> slides = deck.slides();
            for (DeckSlide slide : slides) {
                boolean chartInserted = false;
                boolean slideModified = false;
                for (DeckShape shape : slide.shapes()) {
                    if (!chartInserted) {
                        Optional<TextUnit> slot = findChartSlot(shape);
                        if (slot.isPresent()) {
                            TextUnit unit = slot.get();
                            unit.clear();
                            slide.insertPicture(chart, unit.bounds());
                            chartInserted = true;
                            slideModified = true;
                            LOG.info("Chart inserted on slide {} '{}'", slide.number(), slide.title());
                        }
                    }
                    if (resolver.resolve(shape, tokens)) {
                        shapesReplaced++;
                        slideModified = true;
                    }
                }
                if (slideModified) {
                    slidesModified++;
                }
            }
            LOG.info(
                "Composed deck from {}: slides modified {}/{}, shapes replaced {}",
                template.getFileName(),
                slidesModified,
                slides.size(),
                shapesReplaced
            );
            return deck.toBytes();
        }
    }

    private Optional<TextUnit> findChartSlot(DeckShape shape) {
        TextUnit[] slot = {null};
        TextVisitor.walk(shape, unit -> {
            if (slot[0] == null && unit.text().contains(CHART_TOKEN)) {
                slot[0] = unit;
            }
        });
        return Optional.ofNullable(slot[0]);
    }
}
