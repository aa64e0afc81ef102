package io.reviewdeck.core.recommendation;

import io.reviewdeck.core.metrics.MetricsResult;
import java.util.List;
import java.util.Objects;

public record RecommendationRequest(
    String clientName,
    String reviewPeriod,
    MetricsResult metrics,
    List<String> ticketSummaries,
    int count
) {
    public static final int MIN_COUNT = 1;
    public static final int MAX_COUNT = 10;

    public RecommendationRequest {
        Objects.requireNonNull(clientName, "clientName must not be null");
        Objects.requireNonNull(reviewPeriod, "reviewPeriod must not be null");
        metrics = metrics == null ? MetricsResult.empty() : metrics;
        ticketSummaries = ticketSummaries == null ? List.of() : List.copyOf(ticketSummaries);
        count = Math.max(MIN_COUNT, Math.min(MAX_COUNT, count));
    }
}
