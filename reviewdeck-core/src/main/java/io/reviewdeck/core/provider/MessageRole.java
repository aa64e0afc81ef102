package io.reviewdeck.core.provider;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
