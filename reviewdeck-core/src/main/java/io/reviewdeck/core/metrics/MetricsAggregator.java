package io.reviewdeck.core.metrics;

import io.reviewdeck.core.ticket.TicketRecord;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MetricsAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(MetricsAggregator.class);
    static final int CRITICAL_PRIORITY = 1;

    private final ClassificationConfig classification;

    public MetricsAggregator() {
        this(ClassificationConfig.defaults());
    }

    public MetricsAggregator(ClassificationConfig classification) {
        this.classification = Objects.requireNonNull(classification, "classification must not be null");
    }

    public MetricsResult aggregate(List<TicketRecord> tickets) {
        if (tickets == null || tickets.isEmpty()) {
            LOG.warn("No ticket data provided, all metrics defaulted to {}", MetricsResult.NOT_AVAILABLE);
            return MetricsResult.empty();
        }

        Tally tally = new Tally();
        for (TicketRecord ticket : tickets) {
            if (ticket == null) {
                LOG.warn("Skipping null ticket entry");
                continue;
            }
            classify(ticket, tally);
            countSameDay(ticket, tally);
            countCritical(ticket, tally);
            countFirstResponse(ticket, tally);
        }

        int typed = tally.proactive + tally.reactive;
        int proactivePct = percent(tally.proactive, typed);
        // Reactive is the complement of proactive: the pair totals 100 whenever any ticket was classified.
        int reactivePct = typed == 0 ? 0 : 100 - proactivePct;
        return new MetricsResult(
            tickets.size(),
            proactivePct,
            reactivePct,
            percent(tally.sameDay, tally.closed),
            criticalResolutionTime(tally),
            averageFirstResponse(tally),
            true
        );
    }

    private void classify(TicketRecord ticket, Tally tally) {
        if (classification.isProactive(ticket.typeId())) {
            tally.proactive++;
        } else if (classification.isReactive(ticket.typeId())) {
            tally.reactive++;
        }
    }

    private void countSameDay(TicketRecord ticket, Tally tally) {
        if (!ticket.closedStrictly()) {
            return;
        }
        tally.closed++;
        String occurred = ticket.occurredAt();
        String closed = ticket.closedAt();
        if (occurred == null || occurred.isBlank() || closed == null || closed.isBlank()) {
            return;
        }
        if (sameCalendarDay(ticket.id(), occurred, closed)) {
            tally.sameDay++;
        }
    }

    private static boolean sameCalendarDay(String ticketId, String occurred, String closed) {
        try {
            return Timestamps.calendarDate(occurred).equals(Timestamps.calendarDate(closed));
        } catch (DateTimeParseException e) {
            LOG.warn("Ticket {} has unparseable dates ({}), comparing their date text instead", ticketId, e.getMessage());
            return Timestamps.datePart(occurred).equals(Timestamps.datePart(closed));
        }
    }

    private void countCritical(TicketRecord ticket, Tally tally) {
        if (ticket.priorityId() == null || ticket.priorityId() != CRITICAL_PRIORITY) {
            return;
        }
        tally.critical++;
        Double age = ticket.ageHours();
        if (age != null && !age.isNaN() && !age.isInfinite() && age > 0) {
            tally.criticalAgeHours += age;
        } else {
            LOG.debug("Critical ticket {} has non-positive age {}, excluded from resolution time", ticket.id(), age);
        }
    }

    private void countFirstResponse(TicketRecord ticket, Tally tally) {
        String occurred = ticket.occurredAt();
        String responded = ticket.respondedAt();
        if (occurred == null || occurred.isBlank() || Timestamps.isUnset(responded)) {
            return;
        }
        try {
            LocalDateTime occurredAt = Timestamps.parse(occurred);
            LocalDateTime respondedAt = Timestamps.parse(responded);
            double minutes = Duration.between(occurredAt, respondedAt).toMillis() / 60_000.0;
            if (minutes < 0) {
                LOG.warn("Skipping ticket {}: response date is before occurrence date", ticket.id());
                return;
            }
            tally.responseMinutes += minutes;
            tally.responded++;
        } catch (DateTimeParseException e) {
            LOG.warn("Skipping ticket {}: invalid date format ({})", ticket.id(), e.getMessage());
        }
    }

    private static int percent(int part, int whole) {
        if (whole <= 0) {
            return 0;
        }
        return (int) Math.floor(part * 100.0 / whole);
    }

    private static String criticalResolutionTime(Tally tally) {
        if (tally.critical == 0 || tally.criticalAgeHours <= 0) {
            return MetricsResult.SUB_HOUR;
        }
        return String.format(Locale.ROOT, "%.1f hours", tally.criticalAgeHours / tally.critical);
    }

    private static String averageFirstResponse(Tally tally) {
        if (tally.responded == 0) {
            return MetricsResult.NOT_AVAILABLE;
        }
        double average = tally.responseMinutes / tally.responded;
        if (average < 60) {
            return (int) Math.floor(average) + " mins";
        }
        return String.format(Locale.ROOT, "%.1f hours", average / 60);
    }

    private static final class Tally {
        private int proactive;
        private int reactive;
        private int closed;
        private int sameDay;
        private int critical;
        private double criticalAgeHours;
        private int responded;
        private double responseMinutes;
    }
}
