package io.reviewdeck.core.provider;

import java.util.Map;
import java.util.stream.Collectors;

public record LlmResponse(String content, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM:";

    public LlmResponse {
        content = content == null ? "" : content;
        usage = usage == null
            ? Map.of()
            : usage.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static LlmResponse error(String detail, Map<String, Object> usage) {
        return new LlmResponse(ERROR_PREFIX + " " + detail, usage);
    }

    public boolean isError() {
        return content.startsWith(ERROR_PREFIX);
    }
}
