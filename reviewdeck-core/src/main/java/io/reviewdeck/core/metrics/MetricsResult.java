package io.reviewdeck.core.metrics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

public record MetricsResult(
    int ticketCount,
    int proactivePct,
    int reactivePct,
    int sameDayRate,
    String criticalResolutionTime,
    String avgFirstResponse,
    boolean hasData
) {
    public static final String NOT_AVAILABLE = "N/A";
    public static final String SUB_HOUR = "< 1 hour";

    public static MetricsResult empty() {
        return new MetricsResult(0, 0, 0, 0, NOT_AVAILABLE, NOT_AVAILABLE, false);
    }

    public Map<MetricKey, String> values() {
        Map<MetricKey, String> values = new EnumMap<>(MetricKey.class);
        values.put(MetricKey.TICKET_COUNT, String.valueOf(ticketCount));
        values.put(MetricKey.PROACTIVE_PCT, hasData ? String.valueOf(proactivePct) : NOT_AVAILABLE);
        values.put(MetricKey.REACTIVE_PCT, hasData ? String.valueOf(reactivePct) : NOT_AVAILABLE);
        values.put(MetricKey.SAME_DAY_RATE, hasData ? String.valueOf(sameDayRate) : NOT_AVAILABLE);
        values.put(MetricKey.CRITICAL_RESOLUTION_TIME, criticalResolutionTime);
        values.put(MetricKey.AVG_FIRST_RESPONSE, avgFirstResponse);
        return Collections.unmodifiableMap(values);
    }

    public Map<String, String> asTokens() {
        Map<String, String> tokens = new LinkedHashMap<>();
        values().forEach((key, value) -> tokens.put(key.token(), value));
        return Collections.unmodifiableMap(tokens);
    }
}
