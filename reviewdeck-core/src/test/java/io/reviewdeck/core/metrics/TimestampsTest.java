package io.reviewdeck.core.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import org.junit.jupiter.api.Test;

class TimestampsTest {

    @Test
    void shouldParseCommonHaloFormats() {
        LocalDateTime expected = LocalDateTime.of(2026, 2, 17, 9, 30);

        assertThat(Timestamps.parse("2026-02-17T09:30:00")).isEqualTo(expected);
        assertThat(Timestamps.parse("2026-02-17T09:30:00.000")).isEqualTo(expected);
        assertThat(Timestamps.parse("2026-02-17 09:30:00")).isEqualTo(expected);
        assertThat(Timestamps.parse("2026-02-17T09:30:00Z")).isEqualTo(expected);
        assertThat(Timestamps.parse("2026-02-17T11:30:00+02:00")).isEqualTo(expected);
        assertThat(Timestamps.parse("2026-02-17")).isEqualTo(LocalDateTime.of(2026, 2, 17, 0, 0));
    }

    @Test
    void shouldRejectGarbage() {
        assertThatThrownBy(() -> Timestamps.parse("yesterday")).isInstanceOf(DateTimeParseException.class);
        assertThatThrownBy(() -> Timestamps.parse(" ")).isInstanceOf(DateTimeParseException.class);
    }

    @Test
    void shouldTreatYearOneAsUnset() {
        assertThat(Timestamps.isUnset("0001-01-01T00:00:00")).isTrue();
        assertThat(Timestamps.isUnset(null)).isTrue();
        assertThat(Timestamps.isUnset("")).isTrue();
        assertThat(Timestamps.isUnset("2026-02-17T09:30:00")).isFalse();
    }

    @Test
    void shouldCompareDatePortionBeforeTimeSeparator() {
        assertThat(Timestamps.datePart("2026-02-17T23:59:00")).isEqualTo("2026-02-17");
        assertThat(Timestamps.datePart("2026-02-17 23:59:00")).isEqualTo("2026-02-17");
        assertThat(Timestamps.datePart("2026-02-17")).isEqualTo("2026-02-17");
    }

    @Test
    void shouldReadCalendarDateAsWrittenWithoutShiftingOffset() {
        LocalDate expected = LocalDate.of(2026, 2, 17);

        assertThat(Timestamps.calendarDate("2026-02-17 09:30:00")).isEqualTo(expected);
        assertThat(Timestamps.calendarDate("2026-02-17")).isEqualTo(expected);
        assertThat(Timestamps.calendarDate("2026-02-17T01:00:00+05:00")).isEqualTo(expected);
        assertThatThrownBy(() -> Timestamps.calendarDate("2026-02-17 late")).isInstanceOf(DateTimeParseException.class);
    }
}
