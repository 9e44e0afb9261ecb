package io.github.samzhu.gamulti.dto.tool;

import java.time.LocalDate;

import io.github.samzhu.gamulti.model.DateRange;

/**
 * 回應中的日期區間，附帶人類可讀說明。
 *
 * @param startDate 起始日期
 * @param endDate 結束日期
 * @param days 天數
 * @param description 說明，例如 "Last 7 days"
 */
public record DateRangeView(
    LocalDate startDate,
    LocalDate endDate,
    long days,
    String description
) {
    public static DateRangeView of(DateRange range, String description) {
        return new DateRangeView(range.start(), range.end(), range.days(), description);
    }
}
