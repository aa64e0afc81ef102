package io.reviewdeck.core.config;

import io.reviewdeck.core.config.model.ReportSettings;
import io.reviewdeck.core.deck.poi.MasterTemplateBuilder;
import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".reviewdeck", "config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".reviewdeck", "workspace");
        }
        return expandHome(rawPath);
    }

    public static Path resolveTemplate(ReportSettings report) {
        if (report.templatePath() == null || report.templatePath().isBlank()) {
            return resolveWorkspace(report.workspace()).resolve(MasterTemplateBuilder.DEFAULT_FILE_NAME);
        }
        return expandHome(report.templatePath());
    }

    private static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
