package mgnrega.tracker.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Month arithmetic for performance rows. A data month is always the first day of a month.
 */
public final class ReportingPeriod {

    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM", Locale.ENGLISH);

    private ReportingPeriod() {
    }

    /**
     * The month data is generated for: the previous calendar month, because the running
     * month is still incomplete.
     */
    public static LocalDate currentDataMonth(Clock clock) {
        return YearMonth.now(clock).minusMonths(1).atDay(1);
    }

    public static LocalDate previousMonth(LocalDate dataMonth) {
        return dataMonth.minusMonths(1);
    }

    public static LocalDate sameMonthLastYear(LocalDate dataMonth) {
        return dataMonth.minusYears(1);
    }

    public static String monthLabel(LocalDate dataMonth) {
        return MONTH_LABEL.format(dataMonth);
    }

    public static String monthKey(LocalDate dataMonth) {
        return MONTH_KEY.format(dataMonth);
    }
}
