package io.reviewdeck.core.template;

public final class Tokens {
    public static final String OPEN = "{{";
    public static final String CLOSE = "}}";
    public static final String CHART_PLACEHOLDER = "CHART_PLACEHOLDER";
    public static final String CLIENT_NAME = "CLIENT_NAME";
    public static final String REVIEW_PERIOD = "REVIEW_PERIOD";
    public static final String MSP_CONTACT_INFO = "MSP_CONTACT_INFO";
    public static final String RECOMMENDATION_PREFIX = "RECOMMENDATION_";

    private Tokens() {
    }

    public static String delimited(String name) {
        return OPEN + name + CLOSE;
    }

    /**
     * Accepts {@code NAME} or {@code {{NAME}}} and returns {@code NAME}.
     */
    public static String normalize(String key) {
        String trimmed = key.trim();
        if (trimmed.startsWith(OPEN) && trimmed.endsWith(CLOSE) && trimmed.length() > OPEN.length() + CLOSE.length()) {
            return trimmed.substring(OPEN.length(), trimmed.length() - CLOSE.length()).trim();
        }
        return trimmed;
    }

    public static String recommendation(int number) {
        return RECOMMENDATION_PREFIX + number;
    }
}
