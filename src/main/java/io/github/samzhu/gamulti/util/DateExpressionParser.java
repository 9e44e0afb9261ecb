package io.github.samzhu.gamulti.util;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import io.github.samzhu.gamulti.exception.UnparseableDateException;
import io.github.samzhu.gamulti.model.DateRange;

/**
 * 將自然語言日期表達式轉換為日曆日期。
 *
 * <p>支援格式（不分大小寫）：
 * <ul>
 *   <li>{@code 2026-01-15}、{@code 01/15/2026}</li>
 *   <li>{@code today}、{@code yesterday}</li>
 *   <li>{@code 7daysAgo}、{@code 7 days ago}、{@code 2 weeks ago}、{@code 3monthsAgo}（每月以 30 天計）</li>
 *   <li>{@code last week}、{@code this week}（以週一為一週開始）</li>
 *   <li>{@code last month}、{@code this month}、{@code this year} / {@code ytd}、{@code last year}</li>
 * </ul>
 *
 * <p>相對日期以注入的 {@link Clock} 計算，方便測試固定「今天」。
 */
@Component
public class DateExpressionParser {

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern US_DATE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");
    private static final Pattern DAYS_AGO = Pattern.compile("^(\\d+)\\s*days?\\s*ago$");
    private static final Pattern WEEKS_AGO = Pattern.compile("^(\\d+)\\s*weeks?\\s*ago$");
    private static final Pattern MONTHS_AGO = Pattern.compile("^(\\d+)\\s*months?\\s*ago$");

    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);
    private static final DateTimeFormatter SHORT_DATE_WITH_YEAR =
        DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.ENGLISH);

    private final Clock clock;

    public DateExpressionParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * 解析單一日期表達式。
     *
     * @throws UnparseableDateException 無法辨識的格式或不存在的日期
     */
    public LocalDate parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new UnparseableDateException(expression, "Date expression cannot be empty");
        }
        String value = expression.trim().toLowerCase(Locale.ROOT);
        LocalDate today = LocalDate.now(clock);

        if (ISO_DATE.matcher(value).matches()) {
            try {
                return LocalDate.parse(value);
            } catch (DateTimeParseException e) {
                throw new UnparseableDateException(expression, "Invalid date: " + expression);
            }
        }

        Matcher us = US_DATE.matcher(value);
        if (us.matches()) {
            try {
                return LocalDate.of(
                    Integer.parseInt(us.group(3)), Integer.parseInt(us.group(1)), Integer.parseInt(us.group(2)));
            } catch (DateTimeException e) {
                throw new UnparseableDateException(expression, "Invalid date: " + expression + ". " + e.getMessage());
            }
        }

        Matcher m;
        if ((m = DAYS_AGO.matcher(value)).matches()) {
            return daysBefore(today, m.group(1), 1, expression);
        }
        if ((m = WEEKS_AGO.matcher(value)).matches()) {
            return daysBefore(today, m.group(1), 7, expression);
        }
        if ((m = MONTHS_AGO.matcher(value)).matches()) {
            return daysBefore(today, m.group(1), 30, expression);
        }

        return switch (value.replace(" ", "")) {
            case "today" -> today;
            case "yesterday" -> today.minusDays(1);
            case "thisweek" -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case "lastweek" -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
            case "thismonth" -> today.withDayOfMonth(1);
            case "lastmonth" -> today.withDayOfMonth(1).minusMonths(1);
            case "thisyear", "ytd" -> today.withDayOfYear(1);
            case "lastyear" -> today.withDayOfYear(1).minusYears(1);
            default -> throw new UnparseableDateException(expression,
                String.format("Could not parse date: '%s'", expression));
        };
    }

    private static LocalDate daysBefore(LocalDate today, String count, long unitDays, String expression) {
        try {
            return today.minusDays(Math.multiplyExact(Long.parseLong(count), unitDays));
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            throw new UnparseableDateException(expression, "Date offset out of range: " + expression);
        }
    }

    /**
     * 解析起訖日期並檢查順序。
     *
     * @throws UnparseableDateException 任一日期無法解析，或起始日期晚於結束日期
     */
    public DateRange parseRange(String start, String end) {
        LocalDate startDate = parse(start);
        LocalDate endDate = parse(end);
        if (startDate.isAfter(endDate)) {
            throw new UnparseableDateException(start, String.format(
                "Start date (%s) must be before or equal to end date (%s)", startDate, endDate));
        }
        return new DateRange(startDate, endDate);
    }

    /**
     * 產生日期區間的人類可讀說明，例如 "Last 7 days"、"Jan 01 - Jan 31, 2026 (31 days)"。
     */
    public String describe(DateRange range) {
        LocalDate today = LocalDate.now(clock);
        long days = range.days();

        if (range.start().equals(range.end())) {
            if (range.end().equals(today)) {
                return "Today";
            }
            if (range.end().equals(today.minusDays(1))) {
                return "Yesterday";
            }
            return range.start().format(LONG_DATE);
        }

        if (range.end().equals(today) && (days == 7 || days == 14 || days == 28 || days == 30 || days == 90)) {
            return "Last " + days + " days";
        }

        return String.format("%s - %s (%d days)",
            range.start().format(SHORT_DATE), range.end().format(SHORT_DATE_WITH_YEAR), days);
    }
}
