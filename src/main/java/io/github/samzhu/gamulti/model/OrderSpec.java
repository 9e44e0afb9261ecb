package io.github.samzhu.gamulti.model;

/**
 * 報表排序設定。
 *
 * @param field 排序欄位（metric 或 dimension）
 * @param desc 是否遞減排序
 */
public record OrderSpec(
    String field,
    boolean desc
) {
    public OrderSpec {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("order_by requires a field");
        }
    }
}
