package io.reviewdeck.cli;

import io.reviewdeck.core.config.model.ReviewDeckConfig;
import io.reviewdeck.core.ticket.TicketSource;

@FunctionalInterface
public interface TicketSourceFactory {
    TicketSource create(ReviewDeckConfig config);
}
