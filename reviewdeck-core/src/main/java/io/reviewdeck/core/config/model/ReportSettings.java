package io.reviewdeck.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportSettings(
    String workspace,
    @JsonAlias({"template_path"}) String templatePath,
    String model,
    @JsonAlias({"recommendation_count"}) int recommendationCount,
    @JsonAlias({"sample_size"}) int sampleSize,
    @JsonAlias({"msp_contact"}) String mspContact
) {

    public static ReportSettings defaults() {
        return new ReportSettings(
            "~/.reviewdeck/workspace",
            "",
            "claude-sonnet-4-5-20250929",
            3,
            100,
            ""
        );
    }
}
