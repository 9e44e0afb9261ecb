package io.github.samzhu.gamulti.model;

import java.time.LocalDate;

/**
 * 查詢日期區間（起訖皆含）。
 *
 * @param start 起始日期
 * @param end 結束日期，必須不早於 {@code start}
 */
public record DateRange(
    LocalDate start,
    LocalDate end
) {
    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range requires both start and end dates");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                String.format("Start date (%s) must be before or equal to end date (%s)", start, end));
        }
    }

    /**
     * 區間包含的天數。
     */
    public long days() {
        return end.toEpochDay() - start.toEpochDay() + 1;
    }
}
