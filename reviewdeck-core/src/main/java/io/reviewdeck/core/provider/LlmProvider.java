package io.reviewdeck.core.provider;

import java.util.List;

public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages, int maxTokens);
}
