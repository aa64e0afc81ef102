package io.reviewdeck.core.template;

import java.util.ArrayList;
import java.util.List;

public final class TokenValidator {
    public static final List<String> CONTEXT_TOKENS = List.of(
        Tokens.CLIENT_NAME,
        Tokens.REVIEW_PERIOD,
        Tokens.recommendation(1),
        Tokens.recommendation(2),
        Tokens.recommendation(3),
        Tokens.MSP_CONTACT_INFO
    );

    private TokenValidator() {
    }

    public static List<String> missing(TokenMap tokens, List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            String value = tokens.get(name);
            if (value == null || value.isBlank()) {
                missing.add(name);
            }
        }
        return missing;
    }
}
