package io.reviewdeck.core.ticket;

public record TicketRecord(
    String id,
    Integer typeId,
    Integer priorityId,
    Boolean closed,
    String occurredAt,
    String respondedAt,
    String closedAt,
    Double ageHours,
    String summary,
    String clientId
) {

    public TicketRecord(
        String id,
        Integer typeId,
        Integer priorityId,
        Boolean closed,
        String occurredAt,
        String respondedAt,
        String closedAt,
        Double ageHours,
        String summary
    ) {
        this(id, typeId, priorityId, closed, occurredAt, respondedAt, closedAt, ageHours, summary, null);
    }

    public boolean closedStrictly() {
        return Boolean.TRUE.equals(closed);
    }

    public String summaryOrEmpty() {
        return summary == null ? "" : summary;
    }
}
