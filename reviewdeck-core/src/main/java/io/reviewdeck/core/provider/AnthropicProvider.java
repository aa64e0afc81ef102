package io.reviewdeck.core.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AnthropicProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(AnthropicProvider.class);

    public static final String DEFAULT_API_BASE = "https://api.anthropic.com/v1";
    static final String API_VERSION = "2023-06-01";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> USAGE_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final String apiKey;
    private final HttpUrl messagesUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    public AnthropicProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(120))
            .build());
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, OkHttpClient client) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.messagesUrl = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"))
            .newBuilder()
            .addPathSegment("messages")
            .build();
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, int maxTokens) {
        if (apiKey.isBlank()) {
            return LlmResponse.error("missing API key for provider " + name, Map.of());
        }
        MessagesPayload payload = MessagesPayload.of(model, maxTokens, messages);
        try (Response response = client.newCall(post(payload)).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                LOG.warn("Anthropic call for model {} returned HTTP {}", model, response.code());
                return LlmResponse.error("HTTP " + response.code() + " " + body, Map.of("http_status", response.code()));
            }
            return body.isBlank() ? new LlmResponse("", Map.of()) : read(body);
        } catch (IOException e) {
            LOG.warn("Anthropic call for model {} failed: {}", model, e.getMessage());
            return LlmResponse.error(e.getMessage(), Map.of());
        }
    }

    private Request post(MessagesPayload payload) throws IOException {
        return new Request.Builder()
            .url(messagesUrl)
            .header("x-api-key", apiKey)
            .header("anthropic-version", API_VERSION)
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();
    }

    private LlmResponse read(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        JsonNode usage = root.path("usage");
        return new LlmResponse(text.toString(), usage.isObject() ? mapper.convertValue(usage, USAGE_TYPE) : Map.of());
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record MessagesPayload(
        String model,
        @JsonProperty("max_tokens") int maxTokens,
        String system,
        List<WireMessage> messages
    ) {
        static MessagesPayload of(String model, int maxTokens, List<ChatMessage> messages) {
            String system = messages.stream()
                .filter(m -> m.role() == MessageRole.SYSTEM)
                .map(ChatMessage::content)
                .filter(c -> !c.isBlank())
                .collect(Collectors.joining("\n\n"));
            List<WireMessage> conversation = messages.stream()
                .filter(m -> m.role() != MessageRole.SYSTEM)
                .map(m -> new WireMessage(m.role() == MessageRole.ASSISTANT ? "assistant" : "user", m.content()))
                .toList();
            return new MessagesPayload(model, maxTokens, system, conversation);
        }
    }

    record WireMessage(String role, String content) {
    }
}
