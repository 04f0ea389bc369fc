package dev.univer.gainspend.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;

/**
 * Полуоткрытый период [from, to). Любая граница может отсутствовать (null).
 */
public record DateRange(LocalDateTime from, LocalDateTime to) {

    public static DateRange allTime() {
        return new DateRange(null, null);
    }

    public static DateRange ofMonth(YearMonth month) {
        return new DateRange(month.atDay(1).atStartOfDay(), month.plusMonths(1).atDay(1).atStartOfDay());
    }

    public static DateRange currentMonth(LocalDate today) {
        return ofMonth(YearMonth.from(today));
    }
}
