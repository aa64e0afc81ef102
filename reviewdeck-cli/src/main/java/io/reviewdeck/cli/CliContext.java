package io.reviewdeck.cli;

import io.reviewdeck.core.config.ConfigService;
import io.reviewdeck.core.config.model.ReviewDeckConfig;
import io.reviewdeck.core.provider.DisabledProvider;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    TicketSourceFactory ticketSources,
    ProviderFactory providers
) {
    public CliContext(ConfigService configService, Path configPath, TicketSourceFactory ticketSources) {
        this(configService, configPath, Map.of(), ticketSources, config -> new DisabledProvider("anthropic", "no provider wired"));
    }

    public ReviewDeckConfig loadConfig() throws IOException {
        return configService.load(configPath).withEnvironment(environment);
    }
}
