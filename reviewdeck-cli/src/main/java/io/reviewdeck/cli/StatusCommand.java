package io.reviewdeck.cli;

import io.reviewdeck.core.config.ConfigPaths;
import io.reviewdeck.core.config.model.ReviewDeckConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReviewDeckConfig config = context.loadConfig();
            Path template = ConfigPaths.resolveTemplate(config.report());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + ConfigPaths.resolveWorkspace(config.report().workspace()));
            System.out.println("Template: " + template);
            System.out.println("Template exists: " + Files.exists(template));
            System.out.println("HaloPSA configured: " + config.halo().configured());
            System.out.println("HaloPSA host: " + (config.halo().host().isBlank() ? "(not set)" : config.halo().host()));
            System.out.println("Anthropic configured: " + config.anthropic().configured());
            System.out.println("Recommendation model: " + config.report().model());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
