package io.reviewdeck.core.config;

import java.nio.file.Path;

public record OnboardResult(
    Path configPath,
    Path workspacePath,
    Path templatePath,
    boolean createdConfig,
    boolean overwrittenConfig,
    boolean createdTemplate
) {
}
