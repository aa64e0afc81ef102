package io.reviewdeck.core.ticket;

import java.util.List;

public interface TicketSource {
    String name();

    /**
     * Returns the tickets for the query. An unavailable or empty upstream answer is an empty list.
     */
    List<TicketRecord> fetchTickets(TicketQuery query);

    List<ClientSummary> listClients();
}
