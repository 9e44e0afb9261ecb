package io.github.samzhu.gamulti.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.gamulti.config.GaMultiProperties.ResolverConfig;
import io.github.samzhu.gamulti.exception.ConfigurationException;

class PropertyAliasesTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldLookUpAliasIgnoringCaseAndPunctuation() {
        PropertyAliases aliases = new PropertyAliases(Map.of("My Blog", List.of("Main Site")));

        assertThat(aliases.canonicalFor("main-site")).contains("My Blog");
        assertThat(aliases.canonicalFor("MAIN SITE")).contains("My Blog");
        assertThat(aliases.canonicalFor("blog")).isEmpty();
    }

    @Test
    void shouldMergeJsonOverConfiguredAliases() {
        // Given
        ResolverConfig config = new ResolverConfig(null, null,
            Map.of("My Blog", List.of("main")),
            "{\"Online Store\": [\"shop\", \"ecommerce\"], \"My Blog\": [\"blog home\"]}");

        // When
        PropertyAliases aliases = PropertyAliases.from(config, objectMapper);

        // Then: JSON 覆蓋同名設定
        assertThat(aliases.canonicalFor("shop")).contains("Online Store");
        assertThat(aliases.canonicalFor("blog home")).contains("My Blog");
        assertThat(aliases.canonicalFor("main")).isEmpty();
        assertThat(aliases.size()).isEqualTo(3);
    }

    @Test
    void shouldRejectMalformedJson() {
        ResolverConfig config = new ResolverConfig(null, null, null, "{not json");

        assertThatThrownBy(() -> PropertyAliases.from(config, objectMapper))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("GA_PROPERTY_ALIASES");
    }

    @Test
    void shouldIgnoreBlankJson() {
        ResolverConfig config = new ResolverConfig(null, null, null, " ");

        assertThat(PropertyAliases.from(config, objectMapper).size()).isZero();
    }
}
