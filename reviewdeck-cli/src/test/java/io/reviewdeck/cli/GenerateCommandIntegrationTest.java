package io.reviewdeck.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.reviewdeck.core.config.ConfigService;
import io.reviewdeck.core.deck.poi.MasterTemplateBuilder;
import io.reviewdeck.core.deck.poi.PoiDeck;
import io.reviewdeck.core.provider.AnthropicProvider;
import io.reviewdeck.core.template.TokenScanner;
import io.reviewdeck.core.ticket.TicketRecord;
import io.reviewdeck.core.ticket.TicketRecords;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GenerateCommandIntegrationTest {
    private static final String TICKETS = """
        {"tickets": [
          {"id": 1001, "tickettype_id": 1, "priority_id": 3, "hasbeenclosed": true,
           "dateoccurred": "2026-02-17T09:00:00", "responsedate": "2026-02-17T09:15:00",
           "dateclosed": "2026-02-17T11:30:00", "ticketage": 2.5, "summary": "Printer offline"},
          {"id": 1002, "tickettype_id": 30, "priority_id": 3, "hasbeenclosed": true,
           "dateoccurred": "2026-02-18T02:00:00", "responsedate": "2026-02-18T02:05:00",
           "dateclosed": "2026-02-18T03:00:00", "ticketage": 1.0, "summary": "Monthly patching"},
          {"id": 1003, "tickettype_id": 1, "priority_id": 1, "hasbeenclosed": true,
           "dateoccurred": "2026-02-19T10:00:00", "responsedate": "2026-02-19T10:05:00",
           "dateclosed": "2026-02-21T14:00:00", "ticketage": 52.0, "summary": "Server down"}
        ]}
        """;

    private MockWebServer server;

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path workspace;
    private Path template;
    private Path ticketsFile;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        workspace = tempDir.resolve("workspace");
        template = new MasterTemplateBuilder().write(tempDir.resolve("template.pptx"));
        ticketsFile = Files.writeString(tempDir.resolve("tickets.json"), TICKETS, StandardCharsets.UTF_8);
        configPath = tempDir.resolve("config.json");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldGenerateDeckFromTicketsFileWithManualRecommendations() throws Exception {
        writeConfig("", "");
        CliContext context = new CliContext(new ConfigService(), configPath, config -> {
            throw new AssertionError("ticket source must not be used with --tickets-file");
        });

        CommandOutput result = CommandOutput.run(
            new GenerateCommand(context),
            "--client-name", "Acme Corp",
            "--from", "2026-01-01",
            "--to", "2026-03-31",
            "--template", template.toString(),
            "--tickets-file", ticketsFile.toString(),
            "--no-ai",
            "--recommendation", "Renew expiring licences",
            "--contact", "Jane Doe | jdoe@msp.example"
        );

        assertThat(result.code()).as(result.err()).isZero();
        Path deck = workspace.resolve("output/Acme_Corp_QBR_20260101.pptx");
        assertThat(deck).exists();
        assertThat(result.out())
            .contains("Retrieved 3 tickets")
            .contains("Unresolved tokens: RECOMMENDATION_2, RECOMMENDATION_3")
            .contains("Deck saved to: " + deck);
        assertThat(unresolved(deck)).containsExactly("RECOMMENDATION_2", "RECOMMENDATION_3");
    }

    @Test
    void shouldFetchTicketsFromSourceAndAskModelForRecommendations() throws Exception {
        writeConfig("sk-ant", server.url("/v1/").toString());
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"content": [{"type": "text", "text": "```json\\n[{\\"title\\": \\"Patch Servers\\", \\"rationale\\": \\"Outages traced to updates.\\"}, {\\"title\\": \\"Add Monitoring\\", \\"rationale\\": \\"Catch issues early.\\"}, {\\"title\\": \\"Review Backups\\", \\"rationale\\": \\"Test restores.\\"}]\\n```"}]}
                """));
        RecordingTicketSource source = new RecordingTicketSource(ticketsFromFile(), List.of());
        CliContext context = new CliContext(
            new ConfigService(),
            configPath,
            Map.of(),
            config -> source,
            config -> new AnthropicProvider("anthropic", config.anthropic().apiKey(), config.anthropic().apiBaseOr(AnthropicProvider.DEFAULT_API_BASE))
        );
        Path output = tempDir.resolve("out/acme.pptx");

        CommandOutput result = CommandOutput.run(
            new GenerateCommand(context),
            "--client", "42",
            "--client-name", "Acme Corp",
            "--from", "2026-01-01",
            "--to", "2026-03-31",
            "--template", template.toString(),
            "--output", output.toString(),
            "--contact", "support@msp.example",
            "--sample-size", "2"
        );

        assertThat(result.code()).as(result.err()).isZero();
        assertThat(result.out()).contains("Generated 3 recommendations").doesNotContain("Unresolved tokens");
        assertThat(unresolved(output)).isEmpty();

        assertThat(source.queries).hasSize(1);
        assertThat(source.queries.get(0).clientId()).isEqualTo("42");
        assertThat(source.queries.get(0).startDate()).isEqualTo(LocalDate.of(2026, 1, 1));
        assertThat(source.queries.get(0).pageSize()).isEqualTo(500);

        RecordedRequest request = server.takeRequest();
        String body = request.getBody().readUtf8();
        assertThat(body)
            .contains("CLIENT: Acme Corp")
            .contains("1. Printer offline")
            .contains("2. Monthly patching")
            .doesNotContain("Server down");
    }

    @Test
    void shouldRejectInvertedDateRange() throws Exception {
        writeConfig("", "");
        CliContext context = new CliContext(new ConfigService(), configPath, config -> new RecordingTicketSource(List.of(), List.of()));

        CommandOutput result = CommandOutput.run(
            new GenerateCommand(context),
            "--client-name", "Acme Corp",
            "--from", "2026-03-31",
            "--to", "2026-03-31",
            "--tickets-file", ticketsFile.toString()
        );

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("start date must be before end date");
    }

    @Test
    void shouldFailWhenNoTicketsAreReturned() throws Exception {
        writeConfig("", "");
        CliContext context = new CliContext(new ConfigService(), configPath, config -> new RecordingTicketSource(List.of(), List.of()));

        CommandOutput result = CommandOutput.run(
            new GenerateCommand(context),
            "--client", "42",
            "--client-name", "Acme Corp",
            "--from", "2026-01-01",
            "--to", "2026-03-31",
            "--template", template.toString()
        );

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("no tickets found for Acme Corp");
    }

    @Test
    void shouldReportMissingTemplate() throws Exception {
        writeConfig("", "");
        CliContext context = new CliContext(new ConfigService(), configPath, config -> new RecordingTicketSource(List.of(), List.of()));

        CommandOutput result = CommandOutput.run(
            new GenerateCommand(context),
            "--client-name", "Acme Corp",
            "--from", "2026-01-01",
            "--to", "2026-03-31",
            "--template", tempDir.resolve("missing.pptx").toString(),
            "--tickets-file", ticketsFile.toString(),
            "--no-ai"
        );

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("Template file not found").contains("reviewdeck template");
    }

    private void writeConfig(String apiKey, String apiBase) throws IOException {
        Files.writeString(configPath, """
            {
              "anthropic": {"apiKey": "%s", "apiBase": "%s"},
              "report": {"workspace": "%s"}
            }
            """.formatted(apiKey, apiBase, workspace.toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
    }

    private List<TicketRecord> ticketsFromFile() throws IOException {
        return TicketRecords.readFile(ticketsFile, new ConfigService().mapper());
    }

    private static Set<String> unresolved(Path deck) throws IOException {
        try (PoiDeck reopened = PoiDeck.fromBytes(Files.readAllBytes(deck))) {
            return TokenScanner.scan(reopened);
        }
    }
}
