package io.reviewdeck.core.metrics;

public enum MetricKey {
    TICKET_COUNT("ticket_count", "TICKET_COUNT"),
    PROACTIVE_PCT("proactive_pct", "PROACTIVE_PERCENT"),
    REACTIVE_PCT("reactive_pct", "REACTIVE_PERCENT"),
    SAME_DAY_RATE("same_day_rate", "SAME_DAY_RATE"),
    CRITICAL_RESOLUTION_TIME("critical_resolution_time", "CRITICAL_RES_TIME"),
    AVG_FIRST_RESPONSE("avg_first_response", "AVG_FIRST_RESPONSE");

    private final String key;
    private final String token;

    MetricKey(String key, String token) {
        this.key = key;
        this.token = token;
    }

    public String key() {
        return key;
    }

    public String token() {
        return token;
    }
}
