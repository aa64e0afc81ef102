package io.reviewdeck.cli;

import io.reviewdeck.core.chart.ChartRenderer;
import io.reviewdeck.core.config.ConfigPaths;
import io.reviewdeck.core.config.WorkspaceBootstrap;
import io.reviewdeck.core.config.model.ReportSettings;
import io.reviewdeck.core.config.model.ReviewDeckConfig;
import io.reviewdeck.core.deck.TemplateNotFoundException;
import io.reviewdeck.core.deck.poi.PoiDeck;
import io.reviewdeck.core.deck.poi.PoiDeckLoader;
import io.reviewdeck.core.metrics.MetricsAggregator;
import io.reviewdeck.core.metrics.MetricsResult;
import io.reviewdeck.core.recommendation.Recommendation;
import io.reviewdeck.core.recommendation.RecommendationEngine;
import io.reviewdeck.core.recommendation.RecommendationRequest;
import io.reviewdeck.core.recommendation.RecommendationTokens;
import io.reviewdeck.core.template.DocumentComposer;
import io.reviewdeck.core.template.PlaceholderResolver;
import io.reviewdeck.core.template.TokenScanner;
import io.reviewdeck.core.template.Tokens;
import io.reviewdeck.core.ticket.TicketQuery;
import io.reviewdeck.core.ticket.TicketRecord;
import io.reviewdeck.core.ticket.TicketRecords;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "generate", description = "Generate a review deck for one client and date range")
public final class GenerateCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

    private final CliContext context;

    @Option(names = "--client", description = "HaloPSA client id")
    String clientId;

    @Option(names = "--client-name", required = true, description = "Client name shown in the deck")
    String clientName;

    @Option(names = "--from", required = true, description = "Start of the review period (yyyy-MM-dd)")
    LocalDate from;

    @Option(names = "--to", required = true, description = "End of the review period (yyyy-MM-dd)")
    LocalDate to;

    @Option(names = "--contact", description = "Contact line for the closing slide")
    String contact;

    @Option(names = "--template", description = "Template deck (defaults to the workspace master template)")
    Path template;

    @Option(names = {"-o", "--output"}, description = "Output file (defaults to <workspace>/output/<client>_QBR_<date>.pptx)")
    Path output;

    @Option(names = "--tickets-file", description = "Read tickets from a JSON file instead of HaloPSA")
    Path ticketsFile;

    @Option(names = "--no-ai", description = "Do not ask the language model for recommendations")
    boolean noAi;

    @Option(names = "--recommendation", description = "Manual recommendation text, repeatable")
    List<String> manualRecommendations = new ArrayList<>();

    @Option(names = "--recommendations", description = "Number of recommendations to request")
    Integer recommendationCount;

    @Option(names = "--sample-size", description = "Number of ticket summaries sent to the model")
    Integer sampleSize;

    public GenerateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (!from.isBefore(to)) {
                System.err.println("Generate failed: start date must be before end date");
                return 1;
            }
            ReviewDeckConfig config = context.loadConfig();
            ReportSettings report = config.report();

            List<TicketRecord> tickets = loadTickets(config);
            if (tickets.isEmpty()) {
                System.err.println("Generate failed: no tickets found for " + clientName + " in the selected date range");
                return 1;
            }
            System.out.println("Retrieved " + tickets.size() + " tickets");

            MetricsAggregator aggregator = new MetricsAggregator(config.classification());
            MetricsResult metrics = aggregator.aggregate(tickets);
            String reviewPeriod = ReportNames.reviewPeriod(from, to);
            List<Recommendation> recommendations = recommendations(config, metrics, reviewPeriod, tickets);

            Map<String, String> contextTokens = new LinkedHashMap<>();
            contextTokens.put(Tokens.CLIENT_NAME, clientName);
            contextTokens.put(Tokens.REVIEW_PERIOD, reviewPeriod);
            contextTokens.put(Tokens.MSP_CONTACT_INFO, contact != null ? contact : report.mspContact());
            contextTokens.putAll(RecommendationTokens.toTokens(recommendations));

            DocumentComposer composer = new DocumentComposer(
                new PoiDeckLoader(),
                aggregator,
                new ChartRenderer(),
                new PlaceholderResolver()
            );
            Path templatePath = template != null ? template : ConfigPaths.resolveTemplate(report);
            byte[] deck = composer.compose(templatePath, contextTokens, tickets);

            Path target = output != null ? output : defaultOutput(report);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.write(target, deck);

            Set<String> unresolved = unresolvedTokens(deck);
            if (!unresolved.isEmpty()) {
                System.out.println("Unresolved tokens: " + String.join(", ", unresolved));
            }
            System.out.println("Deck saved to: " + target);
            return 0;
        } catch (TemplateNotFoundException e) {
            System.err.println("Generate failed: " + e.getMessage() + " (run 'reviewdeck template' or 'reviewdeck onboard' first)");
            return 1;
        } catch (Exception e) {
            LOG.debug("Generate failed", e);
            System.err.println("Generate failed: " + e.getMessage());
            return 1;
        }
    }

    private List<TicketRecord> loadTickets(ReviewDeckConfig config) throws IOException {
        if (ticketsFile != null) {
            return TicketRecords.readFile(ticketsFile, context.configService().mapper());
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("--client is required unless --tickets-file is given");
        }
        TicketQuery query = new TicketQuery(clientId, from, to, config.halo().pageSize());
        return context.ticketSources().create(config).fetchTickets(query);
    }

    private List<Recommendation> recommendations(
        ReviewDeckConfig config,
        MetricsResult metrics,
        String reviewPeriod,
        List<TicketRecord> tickets
    ) {
        boolean useAi = !noAi && manualRecommendations.isEmpty() && config.anthropic().configured();
        if (!useAi) {
            return RecommendationTokens.manual(manualRecommendations);
        }
        ReportSettings report = config.report();
        int count = recommendationCount != null ? recommendationCount : report.recommendationCount();
        int sample = sampleSize != null ? sampleSize : report.sampleSize();
        RecommendationEngine engine = new RecommendationEngine(
            context.providers().create(config),
            report.model(),
            context.configService().mapper()
        );
        List<Recommendation> generated = engine.generate(new RecommendationRequest(
            clientName,
            reviewPeriod,
            metrics,
            RecommendationTokens.summaries(tickets, sample),
            count
        ));
        System.out.println("Generated " + generated.size() + " recommendations");
        return generated;
    }

    private Path defaultOutput(ReportSettings report) {
        return ConfigPaths.resolveWorkspace(report.workspace())
            .resolve(WorkspaceBootstrap.OUTPUT_DIR)
            .resolve(ReportNames.outputFileName(clientName, from));
    }

    private Set<String> unresolvedTokens(byte[] deck) throws IOException {
        try (PoiDeck reopened = PoiDeck.fromBytes(deck)) {
            return TokenScanner.scan(reopened);
        }
    }
}
