package io.github.samzhu.gamulti.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.gamulti.model.DateRange;
import io.github.samzhu.gamulti.model.FieldFilter;
import io.github.samzhu.gamulti.model.OrderSpec;
import io.github.samzhu.gamulti.model.QuerySpec;

class CacheKeysTest {

    private static final DateRange MARCH = new DateRange(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31));

    @Test
    void shouldProduceSameKeyForEqualSpecs() {
        QuerySpec a = QuerySpec.of(List.of("sessions"), List.of("date"), MARCH, 100);
        QuerySpec b = QuerySpec.of(List.of("sessions"), List.of("date"), MARCH, 100);

        assertThat(CacheKeys.query("111", a)).isEqualTo(CacheKeys.query("111", b));
        assertThat(CacheKeys.query("111", a)).startsWith("query:111:");
    }

    @Test
    void shouldVaryKeyWithEveryQueryComponent() {
        QuerySpec base = QuerySpec.of(List.of("sessions"), List.of("date"), MARCH, 100);
        String key = CacheKeys.query("111", base);

        assertThat(CacheKeys.query("222", base)).isNotEqualTo(key);
        assertThat(CacheKeys.query("111", QuerySpec.of(List.of("activeUsers"), List.of("date"), MARCH, 100)))
            .isNotEqualTo(key);
        assertThat(CacheKeys.query("111", QuerySpec.of(List.of("sessions"), List.of(), MARCH, 100)))
            .isNotEqualTo(key);
        assertThat(CacheKeys.query("111", QuerySpec.of(List.of("sessions"), List.of("date"),
            new DateRange(MARCH.start(), MARCH.start()), 100))).isNotEqualTo(key);
        assertThat(CacheKeys.query("111", QuerySpec.of(List.of("sessions"), List.of("date"), MARCH, 50)))
            .isNotEqualTo(key);
        assertThat(CacheKeys.query("111", new QuerySpec(List.of("sessions"), List.of("date"), MARCH, 100,
            List.of(new FieldFilter("country", FieldFilter.Operator.EXACT, List.of("Taiwan"))), null)))
            .isNotEqualTo(key);
        assertThat(CacheKeys.query("111", new QuerySpec(List.of("sessions"), List.of("date"), MARCH, 100,
            List.of(), new OrderSpec("sessions", true)))).isNotEqualTo(key);
    }

    @Test
    void shouldBuildMetadataKey() {
        assertThat(CacheKeys.metadata("111")).isEqualTo("metadata:111");
    }
}
