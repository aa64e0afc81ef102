package io.reviewdeck.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.reviewdeck.core.config.ConfigService;
import io.reviewdeck.core.ticket.ClientSummary;
import io.reviewdeck.core.ticket.TicketSource;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceCommandsTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path workspace;

    @BeforeEach
    void setUp() throws Exception {
        configPath = tempDir.resolve(".reviewdeck/config.json");
        workspace = tempDir.resolve("workspace");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, """
            {"report": {"workspace": "%s"}}
            """.formatted(workspace.toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
    }

    @Test
    void templateShouldWriteToRequestedPath() {
        Path target = tempDir.resolve("decks/master.pptx");

        CommandOutput result = CommandOutput.run(new TemplateCommand(context(null)), "--output", target.toString());

        assertThat(result.code()).isZero();
        assertThat(target).exists();
        assertThat(result.out()).contains("Master template written to: " + target);
    }

    @Test
    void onboardShouldPrepareWorkspaceAndTemplate() {
        CommandOutput result = CommandOutput.run(new OnboardCommand(context(null)));

        assertThat(result.code()).isZero();
        assertThat(result.out())
            .contains("Config merged with current defaults: " + configPath)
            .contains("Report workspace: " + workspace)
            .contains("Master template created: ");
        assertThat(workspace.resolve("Master_QBR_Template.pptx")).exists();
        assertThat(workspace.resolve("output")).isDirectory();
    }

    @Test
    void statusShouldReportConfigurationFromFileAndEnvironment() {
        CliContext context = new CliContext(
            new ConfigService(),
            configPath,
            Map.of("HALO_HOST", "https://acme.halopsa.com", "CLIENT_ID", "id", "CLIENT_SECRET", "secret"),
            config -> null,
            config -> null
        );

        CommandOutput result = CommandOutput.run(new StatusCommand(context));

        assertThat(result.code()).isZero();
        assertThat(result.out())
            .contains("Config exists: true")
            .contains("Workspace: " + workspace)
            .contains("Template exists: false")
            .contains("HaloPSA configured: true")
            .contains("HaloPSA host: https://acme.halopsa.com")
            .contains("Anthropic configured: false");
    }

    @Test
    void clientsShouldListIdsAndNames() {
        RecordingTicketSource source = new RecordingTicketSource(
            List.of(),
            List.of(new ClientSummary("42", "Acme Corp"), new ClientSummary("43", "Globex"))
        );

        CommandOutput result = CommandOutput.run(new ClientsCommand(context(source)));

        assertThat(result.code()).isZero();
        assertThat(result.out()).contains("42\tAcme Corp").contains("43\tGlobex");
    }

    @Test
    void clientsShouldReportSourceFailures() {
        CliContext context = new CliContext(new ConfigService(), configPath, config -> {
            throw new IllegalStateException("HaloPSA is not configured");
        });

        CommandOutput result = CommandOutput.run(new ClientsCommand(context));

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("Clients command failed: HaloPSA is not configured");
    }

    private CliContext context(TicketSource source) {
        return new CliContext(new ConfigService(), configPath, config -> source);
    }
}
