package io.reviewdeck.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HaloSettings(
    String host,
    @JsonAlias({"client_id"}) String clientId,
    @JsonAlias({"client_secret"}) String clientSecret,
    String scope,
    @JsonAlias({"page_size"}) int pageSize
) {
    public static final String DEFAULT_SCOPE = "all";

    public static HaloSettings defaults() {
        return new HaloSettings("", "", "", DEFAULT_SCOPE, 500);
    }

    public boolean configured() {
        return notBlank(host) && notBlank(clientId) && notBlank(clientSecret);
    }

    public HaloSettings withEnvironment(Map<String, String> env) {
        return new HaloSettings(
            pick(host, env.get("HALO_HOST")),
            pick(clientId, env.get("CLIENT_ID")),
            pick(clientSecret, env.get("CLIENT_SECRET")),
            pick(pick(scope, env.get("HALO_SCOPE")), DEFAULT_SCOPE),
            pageSize
        );
    }

    static String pick(String configured, String fallback) {
        if (notBlank(configured)) {
            return configured;
        }
        return fallback == null ? "" : fallback;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
