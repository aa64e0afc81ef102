package io.reviewdeck.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase
) {

    public static ProviderConfig defaults() {
        return new ProviderConfig("", null);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String apiBaseOr(String fallback) {
        return apiBase == null || apiBase.isBlank() ? fallback : apiBase;
    }

    public ProviderConfig withEnvironment(Map<String, String> env, String apiKeyVariable) {
        return new ProviderConfig(HaloSettings.pick(apiKey, env.get(apiKeyVariable)), apiBase);
    }
}
