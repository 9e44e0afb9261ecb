package io.github.samzhu.gamulti.dto.tool;

import java.util.List;

import io.github.samzhu.gamulti.model.Property;
import io.github.samzhu.gamulti.model.PropertyMetadata;

/**
 * get_property_metadata 工具回應。
 */
public record PropertyMetadataResponse(
    String propertyId,
    String propertyName,
    List<PropertyMetadata.Field> dimensions,
    List<PropertyMetadata.Field> metrics,
    List<PropertyMetadata.Field> customDimensions,
    List<PropertyMetadata.Field> customMetrics,
    int totalDimensions,
    int totalMetrics
) {
    public static PropertyMetadataResponse of(Property property, PropertyMetadata metadata) {
        return new PropertyMetadataResponse(
            property.numericId(),
            property.displayName(),
            metadata.dimensions(),
            metadata.metrics(),
            metadata.customDimensions(),
            metadata.customMetrics(),
            metadata.totalDimensions(),
            metadata.totalMetrics()
        );
    }
}
