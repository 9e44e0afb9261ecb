package io.github.samzhu.gamulti.client;

import java.util.List;

/**
 * Admin API 回傳的帳號摘要，包含其下的 Property。
 *
 * @param accountId 帳號數字 ID（{@code accounts/123} 的最後一段）
 * @param displayName 帳號顯示名稱
 * @param properties 帳號下可存取的 Property
 */
public record DiscoveredAccount(
    String accountId,
    String displayName,
    List<DiscoveredProperty> properties
) {
    public DiscoveredAccount {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    /**
     * Admin API 回傳的 Property 摘要。
     *
     * @param id Property 數字 ID
     * @param resourceName 資源名稱，格式 {@code properties/123}
     * @param displayName 顯示名稱
     */
    public record DiscoveredProperty(
        String id,
        String resourceName,
        String displayName
    ) {}
}
