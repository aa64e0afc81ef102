package io.reviewdeck.core.ticket;

import java.time.LocalDate;
import java.util.Objects;

public record TicketQuery(String clientId, LocalDate startDate, LocalDate endDate, int pageSize) {

    public TicketQuery {
        Objects.requireNonNull(clientId, "clientId must not be null");
        pageSize = pageSize <= 0 ? 500 : pageSize;
    }
}
