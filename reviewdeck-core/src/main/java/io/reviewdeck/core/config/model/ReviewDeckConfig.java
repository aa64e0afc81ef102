package io.reviewdeck.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.reviewdeck.core.metrics.ClassificationConfig;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewDeckConfig(
    HaloSettings halo,
    ProviderConfig anthropic,
    ReportSettings report,
    ClassificationConfig classification
) {

    public static ReviewDeckConfig defaults() {
        return new ReviewDeckConfig(
            HaloSettings.defaults(),
            ProviderConfig.defaults(),
            ReportSettings.defaults(),
            ClassificationConfig.defaults()
        );
    }

    /**
     * Fills blank connection values from the environment. Values present in the file win.
     */
    public ReviewDeckConfig withEnvironment(Map<String, String> env) {
        return new ReviewDeckConfig(
            halo.withEnvironment(env),
            anthropic.withEnvironment(env, "ANTHROPIC_API_KEY"),
            report,
            classification
        );
    }
}
