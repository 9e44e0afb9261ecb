package io.github.samzhu.gamulti.model;

/**
 * GA4 Property。
 *
 * <p>由 {@link io.github.samzhu.gamulti.service.PropertyRegistry} 探索並持有，
 * 其他元件只取得唯讀參考。識別鍵為 {@code numericId}。
 *
 * @param numericId 數字 ID，例如 {@code 123456789}
 * @param resourceName 資源名稱，例如 {@code properties/123456789}
 * @param displayName 顯示名稱
 * @param accountId 所屬帳號數字 ID
 * @param accountName 所屬帳號顯示名稱，可能為空字串
 */
public record Property(
    String numericId,
    String resourceName,
    String displayName,
    String accountId,
    String accountName
) {
    public Property {
        if (numericId == null || numericId.isBlank()) {
            throw new IllegalArgumentException("Property numericId is required");
        }
        if (resourceName == null || resourceName.isBlank()) {
            resourceName = "properties/" + numericId;
        }
        if (displayName == null) {
            displayName = "";
        }
        if (accountName == null) {
            accountName = "";
        }
    }
}
