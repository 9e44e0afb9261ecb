package io.github.samzhu.gamulti.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.client.ApiClientException;
import io.github.samzhu.gamulti.client.ApiFailure;
import io.github.samzhu.gamulti.config.GaMultiProperties;
import io.github.samzhu.gamulti.exception.DiscoveryFailedException;
import io.github.samzhu.gamulti.exception.PropertyNotFoundException;
import io.github.samzhu.gamulti.model.MatchResult;
import io.github.samzhu.gamulti.model.MatchResult.MatchType;
import io.github.samzhu.gamulti.support.FakeAdminApiClient;
import io.github.samzhu.gamulti.support.MutableClock;

class FuzzyPropertyResolverTest {

    private ExecutorService executor;
    private FakeAdminApiClient adminApi;
    private FuzzyPropertyResolver resolver;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        adminApi = FakeAdminApiClient.withDefaultProperties();
        GaMultiProperties properties = new GaMultiProperties(null, null, null, null, null, null);
        PropertyRegistry registry = new PropertyRegistry(adminApi,
            new TtlCache(new MutableClock(Instant.parse("2026-03-11T10:00:00Z")), 100),
            new ApiCallGuard(executor, Duration.ofSeconds(5), false),
            properties);
        PropertyAliases aliases = new PropertyAliases(Map.of(
            "My Blog", List.of("main site", "the blog"),
            "444", List.of("the app")));
        resolver = new FuzzyPropertyResolver(registry, aliases, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReturnEmptyForBlankQuery() {
        assertThat(resolver.resolve("")).isEmpty();
        assertThat(resolver.resolve("   ")).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenNoPropertiesAreAccessible() {
        // Given
        adminApi.setAccounts(List.of());

        // When / Then
        assertThat(resolver.resolve("My Blog")).isEmpty();
    }

    @Test
    void shouldMatchNumericIdRegardlessOfThreshold() {
        // When
        List<MatchResult> plain = resolver.resolve("333", 1.0);
        List<MatchResult> resource = resolver.resolve("properties/333", 1.0);

        // Then
        assertThat(plain).singleElement().satisfies(m -> {
            assertThat(m.property().displayName()).isEqualTo("Online Store");
            assertThat(m.confidence()).isEqualTo(1.0);
            assertThat(m.matchedOn()).isEqualTo(MatchType.EXACT_ID);
        });
        assertThat(resource).isEqualTo(plain);
    }

    @Test
    void shouldMatchAliasToDisplayNameOrId() {
        // When
        MatchResult byName = resolver.resolveRequired("Main-Site");
        MatchResult byId = resolver.resolveRequired("THE APP");

        // Then
        assertThat(byName.property().numericId()).isEqualTo("111");
        assertThat(byName.matchedOn()).isEqualTo(MatchType.ALIAS);
        assertThat(byName.confidence()).isEqualTo(1.0);
        assertThat(byId.property().numericId()).isEqualTo("444");
        assertThat(byId.matchedOn()).isEqualTo(MatchType.ALIAS);
    }

    @Test
    void shouldMatchExactNameIgnoringCaseAndPunctuation() {
        // When
        MatchResult match = resolver.resolveRequired("my-BLOG");

        // Then
        assertThat(match.property().numericId()).isEqualTo("111");
        assertThat(match.matchedOn()).isEqualTo(MatchType.EXACT_NAME);
        assertThat(match.confidence()).isEqualTo(1.0);
    }

    @Test
    void shouldResolvePartialNameWithHighConfidence() {
        // When
        List<MatchResult> matches = resolver.resolve("blog", 0.85);

        // Then: 0.7 + 0.3 * 4/6
        assertThat(matches).isNotEmpty();
        assertThat(matches.get(0).property().numericId()).isEqualTo("111");
        assertThat(matches.get(0).confidence()).isCloseTo(0.9, within(1e-9));
        assertThat(matches.get(0).matchedOn()).isEqualTo(MatchType.PARTIAL);
    }

    @Test
    void shouldTolerateTypos() {
        // When
        MatchResult match = resolver.resolveRequired("Compnay Website");

        // Then
        assertThat(match.property().numericId()).isEqualTo("222");
        assertThat(match.matchedOn()).isEqualTo(MatchType.FUZZY);
        assertThat(match.confidence()).isCloseTo(1.0 - 2.0 / 14, within(1e-9));
    }

    @Test
    void shouldSortBestFirstAndBreakTiesDeterministically() {
        // When
        List<MatchResult> matches = resolver.resolve("store");

        // Then: Store EU 與 Store US 同分，依 ID 排序；Online Store 較長分數較低
        assertThat(matches).extracting(m -> m.property().numericId()).startsWith("555", "666");
        assertThat(matches).extracting(m -> m.property().numericId()).contains("333");
        for (int i = 1; i < matches.size(); i++) {
            assertThat(matches.get(i).confidence()).isLessThanOrEqualTo(matches.get(i - 1).confidence());
        }
        assertThat(resolver.ambiguousWith(matches))
            .singleElement()
            .satisfies(m -> assertThat(m.property().numericId()).isEqualTo("666"));
    }

    @Test
    void shouldOnlyShrinkResultsAsThresholdRises() {
        for (String query : List.of("store", "blog", "web", "app", "mobile")) {
            List<String> loose = resolver.resolve(query, 0.4).stream().map(m -> m.property().numericId()).toList();
            List<String> strict = resolver.resolve(query, 0.7).stream().map(m -> m.property().numericId()).toList();
            assertThat(loose).containsAll(strict);
        }
    }

    @Test
    void shouldReturnSameResultForSameInput() {
        assertThat(resolver.resolve("stor")).isEqualTo(resolver.resolve("stor"));
    }

    @Test
    void shouldLimitSearchResults() {
        assertThat(resolver.search("store", 2)).hasSize(2);
        assertThat(resolver.search("store", 0)).hasSizeLessThanOrEqualTo(5);
    }

    @Test
    void shouldSuggestSimilarNamesWhenNotFound() {
        // When
        PropertyNotFoundException e = resolver.notFound("store euu");

        // Then
        assertThat(e.getSuggestions()).isNotEmpty().hasSizeLessThanOrEqualTo(3);
        assertThat(e.getSuggestions().get(0)).isEqualTo("Store EU (555)");
        assertThat(e.getMessage()).contains("Did you mean");
    }

    @Test
    void shouldThrowNotFoundWhenNothingMatches() {
        assertThatThrownBy(() -> resolver.resolveRequired("zzzz"))
            .isInstanceOf(PropertyNotFoundException.class)
            .satisfies(e -> assertThat(((PropertyNotFoundException) e).getSuggestions()).isEmpty());
    }

    @Test
    void shouldPropagateDiscoveryFailure() {
        // Given
        adminApi.failWith(new ApiClientException(ApiFailure.NETWORK, "listAccountSummaries", "unreachable"));

        // When / Then
        assertThatThrownBy(() -> resolver.resolve("blog"))
            .isInstanceOf(DiscoveryFailedException.class);
    }
}
