package io.github.samzhu.gamulti.dto.tool;

import java.util.List;

import io.github.samzhu.gamulti.model.Property;

/**
 * list_properties 工具回應。
 *
 * @param properties 可存取的 Property
 * @param count Property 數
 */
public record PropertyListResponse(
    List<PropertyView> properties,
    int count
) {
    public static PropertyListResponse from(List<Property> properties) {
        List<PropertyView> views = properties.stream().map(PropertyView::from).toList();
        return new PropertyListResponse(views, views.size());
    }

    /**
     * 單一 Property。
     *
     * @param propertyId 數字 ID
     * @param resourceName 資源名稱
     * @param displayName 顯示名稱
     * @param accountId 帳號 ID
     * @param accountName 帳號名稱
     */
    public record PropertyView(
        String propertyId,
        String resourceName,
        String displayName,
        String accountId,
        String accountName
    ) {
        public static PropertyView from(Property property) {
            return new PropertyView(
                property.numericId(),
                property.resourceName(),
                property.displayName(),
                property.accountId(),
                property.accountName()
            );
        }
    }
}
