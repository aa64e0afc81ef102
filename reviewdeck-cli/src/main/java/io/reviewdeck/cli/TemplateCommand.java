package io.reviewdeck.cli;

import io.reviewdeck.core.config.ConfigPaths;
import io.reviewdeck.core.deck.poi.MasterTemplateBuilder;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "template", description = "Write the master template deck")
public final class TemplateCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-o", "--output"}, description = "Target file (defaults to the configured template path)")
    Path output;

    public TemplateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Path target = output != null ? output : ConfigPaths.resolveTemplate(context.loadConfig().report());
            new MasterTemplateBuilder().write(target);
            System.out.println("Master template written to: " + target);
            return 0;
        } catch (Exception e) {
            System.err.println("Template command failed: " + e.getMessage());
            return 1;
        }
    }
}
