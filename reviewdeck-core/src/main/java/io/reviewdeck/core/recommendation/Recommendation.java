package io.reviewdeck.core.recommendation;

import java.util.Objects;

public record Recommendation(String title, String rationale) {

    public Recommendation {
        title = Objects.requireNonNull(title, "title must not be null").trim();
        rationale = Objects.requireNonNull(rationale, "rationale must not be null").trim();
    }

    public String asText() {
        return title.isEmpty() ? rationale : title + ": " + rationale;
    }
}
