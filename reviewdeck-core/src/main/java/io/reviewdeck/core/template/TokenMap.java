package io.reviewdeck.core.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class TokenMap {
    private final Map<String, String> values;

    private TokenMap(Map<String, String> values) {
        this.values = values;
    }

    public static TokenMap empty() {
        return new TokenMap(new LinkedHashMap<>());
    }

    public static TokenMap of(Map<String, String> values) {
        return empty().merge(values);
    }

    public TokenMap merge(Map<String, String> more) {
        Map<String, String> merged = new LinkedHashMap<>(values);
        if (more != null) {
            more.forEach((key, value) -> {
                if (key != null && !key.isBlank()) {
                    merged.put(Tokens.normalize(key), value == null ? "" : value);
                }
            });
        }
        return new TokenMap(merged);
    }

    public TokenMap without(String name) {
        Map<String, String> remaining = new LinkedHashMap<>(values);
        remaining.remove(Tokens.normalize(name));
        return new TokenMap(remaining);
    }

    public String get(String name) {
        return values.get(Tokens.normalize(name));
    }

    public boolean contains(String name) {
        return values.containsKey(Tokens.normalize(name));
    }

    public int size() {
        return values.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TokenMap other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "TokenMap" + values.keySet();
    }
}
