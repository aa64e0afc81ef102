package io.reviewdeck.core.recommendation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reviewdeck.core.metrics.MetricKey;
import io.reviewdeck.core.provider.ChatMessage;
import io.reviewdeck.core.provider.LlmProvider;
import io.reviewdeck.core.provider.LlmResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RecommendationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(RecommendationEngine.class);
    private static final int MAX_TOKENS = 2048;
    private static final String FENCE = "```";

    static final String SYSTEM_PROMPT = """
        You are a senior IT consultant and customer success strategist
        specializing in Managed Service Providers (MSPs).
        Your role is to analyze IT support data for a client and generate strategic,
        actionable recommendations that demonstrate the MSP's value and help the client
        improve their IT posture.

        Your recommendations must:
        1. Be a MIX of data-driven insights (grounded in the specific ticket data provided)
           AND general IT best practice recommendations relevant to the client's situation.
        2. Be written in plain, executive-friendly language, no jargon.
        3. Each have a SHORT TITLE (5 words or fewer) and a 1-2 sentence RATIONALE.
        4. Be returned as a valid JSON array ONLY, with no preamble or explanation outside JSON.

        Output format:
        [
          {
            "title": "Short Action Title",
            "rationale": "1-2 sentences explaining why this matters and what action to take."
          }
        ]""";

    private final LlmProvider provider;
    private final String model;
    private final ObjectMapper mapper;

    public RecommendationEngine(LlmProvider provider, String model, ObjectMapper mapper) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public List<Recommendation> generate(RecommendationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        LlmResponse response = provider.chat(
            model,
            List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(userPrompt(request))),
            MAX_TOKENS
        );
        if (response.isError()) {
            throw new RecommendationException(response.content());
        }
        List<Recommendation> recommendations = parse(response.content());
        LOG.info("Provider {} returned {} recommendations for {}", provider.name(), recommendations.size(), request.clientName());
        return recommendations;
    }

    String userPrompt(RecommendationRequest request) {
        Map<MetricKey, String> metrics = request.metrics().values();
        String metricsText = String.join("\n",
            "- Total Tickets: " + metrics.get(MetricKey.TICKET_COUNT),
            "- Same-Day Resolution Rate: " + metrics.get(MetricKey.SAME_DAY_RATE) + "%",
            "- Average First Response Time: " + metrics.get(MetricKey.AVG_FIRST_RESPONSE),
            "- Critical Issue Resolution Time: " + metrics.get(MetricKey.CRITICAL_RESOLUTION_TIME),
            "- Proactive Work: " + metrics.get(MetricKey.PROACTIVE_PCT) + "%",
            "- Reactive Work: " + metrics.get(MetricKey.REACTIVE_PCT) + "%"
        );

        StringBuilder summaries = new StringBuilder();
        int number = 1;
        for (String summary : request.ticketSummaries()) {
            if (summary != null && !summary.isBlank()) {
                summaries.append(number++).append(". ").append(summary.trim()).append('\n');
            }
        }

        return """
            Please generate exactly %d strategic recommendations
            for the following MSP client QBR.

            CLIENT: %s
            REVIEW PERIOD: %s

            --- AGGREGATED METRICS ---
            %s

            --- SAMPLE TICKET SUMMARIES (%d tickets sampled) ---
            %s
            Generate exactly %d recommendations as a JSON array.
            Mix data-driven insights from the ticket summaries with general IT best practices.
            """.formatted(
            request.count(),
            request.clientName(),
            request.reviewPeriod(),
            metricsText,
            request.ticketSummaries().size(),
            summaries,
            request.count()
        );
    }

    List<Recommendation> parse(String raw) {
        String text = stripFence(raw == null ? "" : raw.trim());
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new RecommendationException("Recommendation reply is not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new RecommendationException("Recommendation reply is not a JSON array");
        }
        List<Recommendation> recommendations = new ArrayList<>();
        for (JsonNode item : root) {
            if (!item.isObject() || !item.has("title") || !item.has("rationale")) {
                LOG.debug("Dropping malformed recommendation entry {}", item);
                continue;
            }
            recommendations.add(new Recommendation(item.get("title").asText(""), item.get("rationale").asText("")));
        }
        return recommendations;
    }

    private static String stripFence(String text) {
        if (!text.startsWith(FENCE)) {
            return text;
        }
        String[] parts = text.split(FENCE, -1);
        String inner = parts.length > 1 ? parts[1] : "";
        if (inner.startsWith("json")) {
            inner = inner.substring("json".length());
        }
        return inner.trim();
    }
}
