package io.reviewdeck.core.config;

import io.reviewdeck.core.deck.poi.MasterTemplateBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class WorkspaceBootstrap {
    public static final String OUTPUT_DIR = "output";

    private WorkspaceBootstrap() {
    }

    public static void ensureWorkspace(Path workspace) throws IOException {
        Files.createDirectories(workspace);
        Files.createDirectories(workspace.resolve(OUTPUT_DIR));
    }

    /**
     * Writes the master template unless a file already exists at {@code template}.
     *
     * @return true when a new template was written
     */
    public static boolean ensureTemplate(Path template) throws IOException {
        if (Files.exists(template)) {
            return false;
        }
        new MasterTemplateBuilder().write(template);
        return true;
    }
}
