package io.github.samzhu.gamulti.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.exception.ConfigurationException;
import io.github.samzhu.gamulti.service.ApiCallGuard;
import io.github.samzhu.gamulti.service.PropertyAliases;

class GaMultiPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
        .withUserConfiguration(AppConfig.class);

    @Test
    void shouldApplyDefaultsWhenNothingIsConfigured() {
        contextRunner.run(context -> {
            GaMultiProperties properties = context.getBean(GaMultiProperties.class);

            assertThat(properties.cache().ttl()).isEqualTo(Duration.ofSeconds(300));
            assertThat(properties.cache().propertyTtl()).isEqualTo(Duration.ofSeconds(3600));
            assertThat(properties.cache().maxEntries()).isEqualTo(10_000);
            assertThat(properties.resolver().fuzzyThreshold()).isEqualTo(0.6);
            assertThat(properties.query().defaultRowLimit()).isEqualTo(1000);
            assertThat(properties.query().timeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(properties.error().maskDetails()).isFalse();
            assertThat(properties.mcp().serverName()).isEqualTo("ga-multi-mcp");
            assertThat(context).hasSingleBean(TtlCache.class);
            assertThat(context).hasSingleBean(ApiCallGuard.class);
            assertThat(context).hasBean("fanOutExecutor").hasBean("apiCallExecutor");
        });
    }

    @Test
    void shouldBindConfiguredValues() {
        contextRunner
            .withPropertyValues(
                "ga.cache.ttl-seconds=60",
                "ga.resolver.fuzzy-threshold=0.75",
                "ga.resolver.aliases-json={\"My Blog\": [\"blog\"]}",
                "ga.query.default-row-limit=200",
                "ga.query.timeout=5s",
                "ga.error.mask-details=true")
            .run(context -> {
                GaMultiProperties properties = context.getBean(GaMultiProperties.class);

                assertThat(properties.cache().ttl()).isEqualTo(Duration.ofSeconds(60));
                assertThat(properties.resolver().fuzzyThreshold()).isEqualTo(0.75);
                assertThat(properties.query().defaultRowLimit()).isEqualTo(200);
                assertThat(properties.query().timeout()).isEqualTo(Duration.ofSeconds(5));
                assertThat(properties.error().maskDetails()).isTrue();
                assertThat(context.getBean(PropertyAliases.class).canonicalFor("blog")).contains("My Blog");
            });
    }

    @Test
    void shouldFailStartupOnInvalidThreshold() {
        contextRunner
            .withPropertyValues("ga.resolver.fuzzy-threshold=1.5")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure()).rootCause()
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("ga.resolver.fuzzy-threshold");
            });
    }

    @Test
    void shouldFailStartupOnMalformedAliasJson() {
        contextRunner
            .withPropertyValues("ga.resolver.aliases-json=[oops")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldRejectNonPositiveTtl() {
        assertThatThrownBy(() -> new GaMultiProperties.CacheConfig(0L, null, null, null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("ga.cache.ttl-seconds");
    }

    @Test
    void shouldRejectDefaultLimitAboveMaximum() {
        assertThatThrownBy(() -> new GaMultiProperties.QueryConfig(500, 100, null, null))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldClampRequestedRowLimit() {
        GaMultiProperties.QueryConfig query = new GaMultiProperties.QueryConfig(1000, 10_000, null, null);

        assertThat(query.effectiveLimit(null)).isEqualTo(1000);
        assertThat(query.effectiveLimit(0)).isEqualTo(1000);
        assertThat(query.effectiveLimit(25)).isEqualTo(25);
        assertThat(query.effectiveLimit(50_000)).isEqualTo(10_000);
    }
}
