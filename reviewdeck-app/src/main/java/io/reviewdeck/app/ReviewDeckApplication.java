package io.reviewdeck.app;

import io.reviewdeck.cli.CliContext;
import io.reviewdeck.cli.ClientsCommand;
import io.reviewdeck.cli.GenerateCommand;
import io.reviewdeck.cli.OnboardCommand;
import io.reviewdeck.cli.ReviewDeckCliCommand;
import io.reviewdeck.cli.StatusCommand;
import io.reviewdeck.cli.TemplateCommand;
import io.reviewdeck.core.config.ConfigPaths;
import io.reviewdeck.core.config.ConfigService;
import io.reviewdeck.core.config.model.ProviderConfig;
import io.reviewdeck.core.config.model.ReviewDeckConfig;
import io.reviewdeck.core.provider.AnthropicProvider;
import io.reviewdeck.core.provider.DisabledProvider;
import io.reviewdeck.core.provider.LlmProvider;
import io.reviewdeck.core.ticket.TicketSource;
import io.reviewdeck.halo.HaloClient;
import io.reviewdeck.halo.HaloConnection;
import java.nio.file.Path;
import picocli.CommandLine;

public final class ReviewDeckApplication {

    private ReviewDeckApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            System.getenv(),
            config -> buildTicketSource(configService, config),
            config -> buildAnthropicProvider("anthropic", config.anthropic(), AnthropicProvider.DEFAULT_API_BASE)
        );

        CommandLine commandLine = new CommandLine(new ReviewDeckCliCommand());
        commandLine.addSubcommand("generate", new GenerateCommand(context));
        commandLine.addSubcommand("template", new TemplateCommand(context));
        commandLine.addSubcommand("clients", new ClientsCommand(context));
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static TicketSource buildTicketSource(ConfigService configService, ReviewDeckConfig config) {
        return HaloClient.create(HaloConnection.from(config.halo()), configService.mapper());
    }

    private static LlmProvider buildAnthropicProvider(String name, ProviderConfig providerConfig, String defaultBase) {
        if (providerConfig != null && providerConfig.configured()) {
            return new AnthropicProvider(name, providerConfig.apiKey(), providerConfig.apiBaseOr(defaultBase));
        }
        return new DisabledProvider(name, "missing API key");
    }
}
