package io.reviewdeck.cli;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

final class ReportNames {
    private static final DateTimeFormatter PERIOD_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd", Locale.ROOT);

    private ReportNames() {
    }

    static String reviewPeriod(LocalDate from, LocalDate to) {
        return PERIOD_DATE.format(from) + " – " + PERIOD_DATE.format(to);
    }

    static String outputFileName(String clientName, LocalDate from) {
        String safeName = clientName.replace(" ", "_").replace("/", "-");
        return safeName + "_QBR_" + FILE_DATE.format(from) + ".pptx";
    }
}
