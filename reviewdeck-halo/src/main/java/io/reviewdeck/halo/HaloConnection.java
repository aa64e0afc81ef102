package io.reviewdeck.halo;

import io.reviewdeck.core.config.model.HaloSettings;
import java.time.Duration;
import java.util.Objects;

public record HaloConnection(
    String host,
    String clientId,
    String clientSecret,
    String scope,
    int pageSize,
    Duration timeout
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public HaloConnection {
        host = stripTrailingSlash(host == null ? "" : host.trim());
        clientId = clientId == null ? "" : clientId.trim();
        clientSecret = clientSecret == null ? "" : clientSecret.trim();
        scope = scope == null || scope.isBlank() ? HaloSettings.DEFAULT_SCOPE : scope.trim();
        timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
    }

    public static HaloConnection from(HaloSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return new HaloConnection(
            settings.host(),
            settings.clientId(),
            settings.clientSecret(),
            settings.scope(),
            settings.pageSize(),
            DEFAULT_TIMEOUT
        );
    }

    public boolean configured() {
        return !host.isBlank() && !clientId.isBlank() && !clientSecret.isBlank();
    }

    private static String stripTrailingSlash(String value) {
        String stripped = value;
        while (stripped.endsWith("/")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }
}
