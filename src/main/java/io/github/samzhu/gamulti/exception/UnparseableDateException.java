package io.github.samzhu.gamulti.exception;

/**
 * 日期表達式無法解析例外。
 */
public class UnparseableDateException extends AnalyticsException {

    private static final String SUPPORTED_FORMATS = "Supported formats: YYYY-MM-DD, MM/DD/YYYY, today, yesterday, "
        + "NdaysAgo, NweeksAgo, NmonthsAgo, last week, last month, this week, this month, this year (ytd), last year";

    private final String expression;

    public UnparseableDateException(String expression, String message) {
        super(ErrorKind.UNPARSEABLE_DATE, message, SUPPORTED_FORMATS);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
