package com.kblabs.analytics.domain.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DailyStatsQueryBuilder.
 *
 * <p>Checks the assembled statement text and parameters for the main query shapes.
 */
class DailyStatsQueryBuilderTest {

    private DailyStatsQueryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DailyStatsQueryBuilder(
                new FieldPathResolver(),
                new MetricsSelectBuilder(DefaultMetricsCatalog.standard()),
                new TimeBucketing());
    }

    @Test
    @DisplayName("Defaults: day buckets, fallback metrics, no WHERE")
    void defaultQuery() {
        CompiledStatsQuery compiled = builder.build(DailyStatsQuery.builder().build());

        assertThat(compiled.getSql()).isEqualTo(
                "SELECT to_char(date_trunc('day', ts), 'YYYY-MM-DD') AS \"date\", COUNT(*) AS \"count\", "
                        + "SUM(try_cast_double(jsonb_path_query_first(payload, '$.totalCost') #>> '{}')) AS \"totalCost\", "
                        + "SUM(try_cast_double(jsonb_path_query_first(payload, '$.totalTokens') #>> '{}')) AS \"totalTokens\", "
                        + "SUM(try_cast_double(jsonb_path_query_first(payload, '$.durationMs') #>> '{}')) AS \"durationMs\" "
                        + "FROM events GROUP BY date_trunc('day', ts) ORDER BY date_trunc('day', ts) ASC");
        assertThat(compiled.getParams()).isEmpty();
        assertThat(compiled.getMetricNames()).containsExactly("totalCost", "totalTokens", "durationMs");
        assertThat(compiled.isBreakdown()).isFalse();
    }

    @Test
    @DisplayName("Type filter drives default metrics and the WHERE clause")
    void typeFilterDrivesDefaults() {
        CompiledStatsQuery compiled = builder.build(DailyStatsQuery.builder()
                .filter(EventsFilter.builder().types(List.of("storage.write")).build())
                .groupBy(Granularity.HOUR)
                .build());

        assertThat(compiled.getMetricNames()).containsExactly("bytesRead", "bytesWritten", "durationMs");
        assertThat(compiled.getSql())
                .startsWith("SELECT to_char(date_trunc('hour', ts), 'YYYY-MM-DD\"T\"HH24') AS \"date\"")
                .contains(" FROM events WHERE type = ? GROUP BY date_trunc('hour', ts) ");
        assertThat(compiled.getParams()).containsExactly("storage.write");
    }

    @Test
    @DisplayName("Breakdown adds a projection, a grouping key and NULLS LAST ordering")
    void breakdownQuery() {
        CompiledStatsQuery compiled = builder.build(DailyStatsQuery.builder()
                .groupBy(Granularity.MONTH)
                .breakdownBy("payload.model")
                .metrics(List.of("totalTokens"))
                .build());

        String breakdown = "jsonb_path_query_first(payload, '$.model') #>> '{}'";
        assertThat(compiled.isBreakdown()).isTrue();
        assertThat(compiled.getSql()).isEqualTo(
                "SELECT to_char(date_trunc('month', ts), 'YYYY-MM') AS \"date\", COUNT(*) AS \"count\", "
                        + "SUM(try_cast_double(jsonb_path_query_first(payload, '$.totalTokens') #>> '{}')) AS \"totalTokens\", "
                        + breakdown + " AS \"breakdown\" "
                        + "FROM events GROUP BY date_trunc('month', ts), " + breakdown + " "
                        + "ORDER BY date_trunc('month', ts) ASC, " + breakdown + " ASC NULLS LAST");
    }

    @Test
    @DisplayName("Column breakdown groups on the column")
    void columnBreakdown() {
        CompiledStatsQuery compiled = builder.build(DailyStatsQuery.builder()
                .breakdownBy("actor.id")
                .metrics(List.of())
                .build());

        assertThat(compiled.getSql()).isEqualTo(
                "SELECT to_char(date_trunc('day', ts), 'YYYY-MM-DD') AS \"date\", COUNT(*) AS \"count\", "
                        + "actor_id AS \"breakdown\" FROM events GROUP BY date_trunc('day', ts), actor_id "
                        + "ORDER BY date_trunc('day', ts) ASC, actor_id ASC NULLS LAST");
        assertThat(compiled.getMetricNames()).isEmpty();
    }

    @Test
    @DisplayName("Metrics named like the fixed aliases do not change grouping or ordering")
    void metricNamedLikeFixedAlias() {
        CompiledStatsQuery compiled = builder.build(DailyStatsQuery.builder()
                .breakdownBy("payload.model")
                .metrics(List.of("count", "breakdown"))
                .build());

        assertThat(compiled.getSql())
                .contains("SUM(try_cast_double(jsonb_path_query_first(payload, '$.count') #>> '{}')) AS \"count\"")
                .endsWith("ORDER BY date_trunc('day', ts) ASC, "
                        + "jsonb_path_query_first(payload, '$.model') #>> '{}' ASC NULLS LAST");
        assertThat(compiled.metricColumn(0)).isEqualTo(3);
        assertThat(compiled.breakdownColumn()).isEqualTo(5);
    }

    @Test
    @DisplayName("Time range is bound, not inlined")
    void timeRangeBound() {
        CompiledStatsQuery compiled = builder.build(DailyStatsQuery.builder()
                .filter(EventsFilter.builder()
                        .from(Instant.parse("2026-03-01T00:00:00Z"))
                        .to(Instant.parse("2026-03-02T00:00:00Z"))
                        .build())
                .build());

        assertThat(compiled.getSql()).contains(" WHERE ts >= ? AND ts <= ? ").doesNotContain("2026");
        assertThat(compiled.paramsArray()).hasSize(2);
    }

    @Test
    @DisplayName("Unsafe breakdown path fails before any SQL is produced")
    void unsafeBreakdownRejected() {
        assertThatThrownBy(() -> builder.build(DailyStatsQuery.builder()
                .breakdownBy("payload.model'; DROP TABLE events; --")
                .build()))
                .isInstanceOf(UnsafePathSegmentException.class);
    }
}
