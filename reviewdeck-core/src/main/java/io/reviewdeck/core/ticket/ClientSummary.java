package io.reviewdeck.core.ticket;

public record ClientSummary(String id, String name) {
}
