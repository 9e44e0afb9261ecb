package io.github.samzhu.gamulti.model;

import java.util.List;
import java.util.Locale;

/**
 * 報表篩選條件。
 *
 * <p>欄位若為查詢中的 metric，轉接器會建立 metric filter，否則建立 dimension filter。
 *
 * @param field 欄位名稱（dimension 或 metric 的 API 名稱）
 * @param operator 比對運算子
 * @param values 比對值；除 {@link Operator#IN_LIST} 外只使用第一個值
 */
public record FieldFilter(
    String field,
    Operator operator,
    List<String> values
) {
    public FieldFilter {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Filter field is required");
        }
        if (operator == null) {
            operator = Operator.EXACT;
        }
        values = values == null ? List.of() : List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Filter on '" + field + "' requires a value");
        }
        if (operator.isNumeric()) {
            try {
                Double.parseDouble(values.get(0).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    String.format("Filter %s on '%s' requires a numeric value, got: %s", operator, field, values.get(0)));
            }
        }
    }

    /**
     * 取得單一比對值。
     */
    public String value() {
        return values.get(0);
    }

    /**
     * 篩選運算子。
     */
    public enum Operator {
        EXACT,
        CONTAINS,
        BEGINS_WITH,
        ENDS_WITH,
        REGEXP,
        GREATER_THAN,
        LESS_THAN,
        EQUAL,
        IN_LIST;

        /**
         * 不分大小寫解析運算子名稱，空值視為 {@link #EXACT}。
         *
         * @throws IllegalArgumentException 名稱無法辨識
         */
        public static Operator from(String name) {
            if (name == null || name.isBlank()) {
                return EXACT;
            }
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported filter operator: " + name, e);
            }
        }

        public boolean isNumeric() {
            return this == GREATER_THAN || this == LESS_THAN || this == EQUAL;
        }
    }
}
