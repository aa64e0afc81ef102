package io.reviewdeck.cli;

import io.reviewdeck.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Prepare config, report workspace and master template")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            System.out.println(configLine(result) + result.configPath());
            System.out.println("Report workspace: " + result.workspacePath());
            System.out.println((result.createdTemplate() ? "Master template created: " : "Master template already present: ")
                + result.templatePath());
            System.out.println("Set HALO_HOST, CLIENT_ID and CLIENT_SECRET (or edit the config) before running 'reviewdeck generate'.");
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }

    private static String configLine(OnboardResult result) {
        if (result.createdConfig()) {
            return "Config created: ";
        }
        return result.overwrittenConfig() ? "Config reset to defaults: " : "Config merged with current defaults: ";
    }
}
