package io.reviewdeck.core.recommendation;

import io.reviewdeck.core.template.Tokens;
import io.reviewdeck.core.ticket.TicketRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RecommendationTokens {

    private RecommendationTokens() {
    }

    public static Map<String, String> toTokens(List<Recommendation> recommendations) {
        Map<String, String> tokens = new LinkedHashMap<>();
        int number = 1;
        for (Recommendation recommendation : recommendations) {
            tokens.put(Tokens.recommendation(number++), recommendation.asText());
        }
        return tokens;
    }

    public static List<Recommendation> manual(List<String> texts) {
        List<Recommendation> recommendations = new ArrayList<>();
        if (texts == null) {
            return recommendations;
        }
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text != null && !text.isBlank()) {
                recommendations.add(new Recommendation("Recommendation " + (i + 1), text));
            }
        }
        return recommendations;
    }

    /**
     * Non-blank summaries of the first {@code sampleSize} tickets, in input order.
     */
    public static List<String> summaries(List<TicketRecord> tickets, int sampleSize) {
        List<String> summaries = new ArrayList<>();
        if (tickets == null) {
            return summaries;
        }
        int limit = Math.min(Math.max(0, sampleSize), tickets.size());
        for (TicketRecord ticket : tickets.subList(0, limit)) {
            if (ticket != null && !ticket.summaryOrEmpty().isBlank()) {
                summaries.add(ticket.summaryOrEmpty().trim());
            }
        }
        return summaries;
    }
}
