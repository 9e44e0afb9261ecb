package io.github.samzhu.gamulti.service;

import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.client.ApiClientException;
import io.github.samzhu.gamulti.client.DataApiClient;
import io.github.samzhu.gamulti.config.GaMultiProperties;
import io.github.samzhu.gamulti.dto.tool.PropertyMetadataResponse;
import io.github.samzhu.gamulti.exception.QueryFailedException;
import io.github.samzhu.gamulti.model.Property;
import io.github.samzhu.gamulti.model.PropertyMetadata;
import io.github.samzhu.gamulti.util.CacheKeys;

/**
 * Property metadata 查詢服務。
 *
 * <p>metadata 變動不頻繁，以 Property 清單相同的 TTL 快取於 {@code metadata:<id>}。
 */
@Service
public class PropertyMetadataService {

    private static final Logger log = LoggerFactory.getLogger(PropertyMetadataService.class);

    private final FuzzyPropertyResolver resolver;
    private final DataApiClient dataApiClient;
    private final TtlCache cache;
    private final ApiCallGuard apiCallGuard;
    private final Duration metadataTtl;

    public PropertyMetadataService(
            FuzzyPropertyResolver resolver,
            DataApiClient dataApiClient,
            TtlCache cache,
            ApiCallGuard apiCallGuard,
            GaMultiProperties properties) {
        this.resolver = resolver;
        this.dataApiClient = dataApiClient;
        this.cache = cache;
        this.apiCallGuard = apiCallGuard;
        this.metadataTtl = properties.cache().propertyTtl();
    }

    /**
     * 取得 Property 可用的 dimension 與 metric。
     *
     * @param propertyRef Property 名稱、別名或 ID
     * @throws io.github.samzhu.gamulti.exception.PropertyNotFoundException 無法解析 Property
     * @throws QueryFailedException Data API 呼叫失敗
     */
    public PropertyMetadataResponse getMetadata(String propertyRef) {
        Property property = resolver.resolveRequired(propertyRef).property();
        String key = CacheKeys.metadata(property.numericId());

        Optional<PropertyMetadata> cached = cache.get(key, PropertyMetadata.class);
        if (cached.isPresent()) {
            return PropertyMetadataResponse.of(property, cached.get());
        }

        String operation = "getMetadata(" + property.numericId() + ")";
        PropertyMetadata metadata;
        try {
            metadata = apiCallGuard.call(operation, () -> dataApiClient.getMetadata(property.numericId()));
        } catch (ApiClientException e) {
            throw new QueryFailedException(property.numericId(), e.getFailure(), apiCallGuard.detail(e), e);
        }

        cache.set(key, metadata, metadataTtl);
        log.info("Loaded metadata for property {}: {} dimensions, {} metrics",
            property.numericId(), metadata.totalDimensions(), metadata.totalMetrics());
        return PropertyMetadataResponse.of(property, metadata);
    }
}
