package io.github.samzhu.gamulti.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.client.ApiFailure;
import io.github.samzhu.gamulti.config.GaMultiProperties;
import io.github.samzhu.gamulti.dto.tool.PropertyMetadataResponse;
import io.github.samzhu.gamulti.exception.PropertyNotFoundException;
import io.github.samzhu.gamulti.exception.QueryFailedException;
import io.github.samzhu.gamulti.model.PropertyMetadata;
import io.github.samzhu.gamulti.support.FakeAdminApiClient;
import io.github.samzhu.gamulti.support.FakeDataApiClient;
import io.github.samzhu.gamulti.support.MutableClock;

class PropertyMetadataServiceTest {

    private ExecutorService executor;
    private TtlCache cache;
    private FakeDataApiClient dataApi;
    private PropertyMetadataService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        cache = new TtlCache(new MutableClock(Instant.parse("2026-03-11T10:00:00Z")), 100);
        GaMultiProperties properties = new GaMultiProperties(null, null, null, null, null, null);
        ApiCallGuard guard = new ApiCallGuard(executor, Duration.ofSeconds(5), false);
        PropertyRegistry registry = new PropertyRegistry(
            FakeAdminApiClient.withDefaultProperties(), cache, guard, properties);
        FuzzyPropertyResolver resolver = new FuzzyPropertyResolver(registry, PropertyAliases.empty(), properties);
        dataApi = new FakeDataApiClient();
        service = new PropertyMetadataService(resolver, dataApi, cache, guard, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldSplitStandardAndCustomFields() {
        // When
        PropertyMetadataResponse response = service.getMetadata("Mobile App");

        // Then
        assertThat(response.propertyId()).isEqualTo("444");
        assertThat(response.propertyName()).isEqualTo("Mobile App");
        assertThat(response.dimensions()).extracting(PropertyMetadata.Field::apiName).containsExactly("country");
        assertThat(response.customDimensions()).extracting(PropertyMetadata.Field::apiName)
            .containsExactly("customEvent:plan");
        assertThat(response.totalDimensions()).isEqualTo(2);
        assertThat(response.totalMetrics()).isEqualTo(1);
    }

    @Test
    void shouldCacheMetadataPerProperty() {
        // When
        service.getMetadata("Mobile App");
        service.getMetadata("444");

        // Then
        assertThat(dataApi.getMetadataCalls()).isEqualTo(1);
        assertThat(cache.get("metadata:444", PropertyMetadata.class)).isPresent();
    }

    @Test
    void shouldRaiseQueryFailedOnApiError() {
        // Given
        dataApi.givenFailure("444", ApiFailure.INVALID_REQUEST);

        // When / Then
        assertThatThrownBy(() -> service.getMetadata("Mobile App"))
            .isInstanceOf(QueryFailedException.class)
            .satisfies(e -> assertThat(((QueryFailedException) e).getHint()).contains("get_property_metadata"));
        assertThat(cache.get("metadata:444", PropertyMetadata.class)).isEmpty();
    }

    @Test
    void shouldRaiseNotFoundForUnknownProperty() {
        assertThatThrownBy(() -> service.getMetadata("zzzz"))
            .isInstanceOf(PropertyNotFoundException.class);
        assertThat(dataApi.getMetadataCalls()).isZero();
    }
}
