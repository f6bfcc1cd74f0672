package com.kblabs.analytics.integration;

import com.kblabs.analytics.api.dto.DailyStat;
import com.kblabs.analytics.api.dto.EventRequest;
import com.kblabs.analytics.api.dto.EventsPageResponse;
import com.kblabs.analytics.api.dto.EventsQueryParams;
import com.kblabs.analytics.api.dto.EventsStatsResponse;
import com.kblabs.analytics.api.dto.SourceDto;
import com.kblabs.analytics.api.dto.StatsQueryParams;
import com.kblabs.analytics.domain.service.EventIngestionService;
import com.kblabs.analytics.domain.service.EventQueryService;
import com.kblabs.analytics.domain.service.StatsService;
import com.kblabs.analytics.infrastructure.persistence.SchemaJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

/**
 * Integration test running the stats queries against a real PostgreSQL (via Testcontainers).
 *
 * <p>This test validates:
 * <ul>
 *   <li>The schema DDL can be re-applied to an initialized database</li>
 *   <li>Duplicate event ids are skipped by the insert</li>
 *   <li>Bucket labels, metric sums and breakdown ordering produced by the compiled SQL</li>
 * </ul>
 *
 * <p>Kafka is embedded; events are written through EventIngestionService directly.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@EmbeddedKafka(partitions = 1, topics = {"analytics-events-test", "analytics-events-test.DLT"})
@ActiveProfiles("test")
class AnalyticsIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("kb_analytics_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private EventIngestionService eventIngestionService;

    @Autowired
    private StatsService statsService;

    @Autowired
    private EventQueryService eventQueryService;

    @Autowired
    private SchemaJdbcRepository schemaRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE TABLE events");
        eventIngestionService.processBatch(List.of(
                event("e1", "llm.completion", "2026-03-01T10:15:00Z",
                        Map.of("model", "gpt-4", "totalTokens", 1000, "totalCost", 0.05, "durationMs", 1200)),
                event("e2", "llm.completion", "2026-03-01T18:00:00Z",
                        Map.of("model", "gpt-4", "totalTokens", "500", "totalCost", 0.02)),
                event("e3", "llm.completion", "2026-03-02T09:00:00Z",
                        Map.of("model", "claude", "totalTokens", "n/a", "totalCost", 0.01)),
                event("e4", "cache.hit", "2026-03-01T11:00:00Z",
                        Map.of("durationMs", 3)),
                event("e5", "llm.completion", "2026-03-02T12:00:00Z",
                        Map.of("totalTokens", 10))
        ));
    }

    @Test
    @DisplayName("Schema DDL can be applied again without error")
    void schemaIsReapplicable() {
        assertThatCode(() -> {
            schemaRepository.applySchema();
            schemaRepository.applySchema();
        }).doesNotThrowAnyException();

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM events", Integer.class);
        assertThat(count).isEqualTo(5);
    }

    @Test
    @DisplayName("Re-delivered ids are skipped")
    void duplicateIdsAreSkipped() {
        int inserted = eventIngestionService.processBatch(List.of(
                event("e1", "llm.completion", "2026-03-01T10:15:00Z", Map.of()),
                event("e6", "llm.completion", "2026-03-03T00:00:00Z", Map.of())));

        assertThat(inserted).isEqualTo(1);
    }

    @Test
    @DisplayName("Daily buckets sum numeric metrics and skip non-numeric values")
    void dailyStatsSumMetrics() {
        List<DailyStat> stats = statsService.getDailyStats(StatsQueryParams.builder()
                .type(List.of("llm.completion"))
                .metrics(List.of("totalTokens", "totalCost"))
                .build());

        assertThat(stats).extracting(DailyStat::getDate).containsExactly("2026-03-01", "2026-03-02");
        assertThat(stats).extracting(DailyStat::getCount).containsExactly(2L, 2L);
        assertThat(stats.get(0).getMetrics().get("totalTokens")).isEqualTo(1500.0);
        assertThat(stats.get(0).getMetrics().get("totalCost")).isCloseTo(0.07, within(1e-9));
        assertThat(stats.get(1).getMetrics().get("totalTokens")).isEqualTo(10.0);
        assertThat(stats.get(1).getMetrics().get("totalCost")).isCloseTo(0.01, within(1e-9));
    }

    @Test
    @DisplayName("Metric named count and case-variant metric names keep their own sums")
    void metricAliasesDoNotCollide() {
        eventIngestionService.processBatch(List.of(
                event("e7", "storage.write", "2026-03-04T08:00:00Z",
                        Map.of("count", 7, "totalCost", 0.5, "totalcost", 2))));

        List<DailyStat> stats = statsService.getDailyStats(StatsQueryParams.builder()
                .type(List.of("storage.write"))
                .metrics(List.of("count", "totalCost", "totalcost"))
                .build());

        assertThat(stats).hasSize(1);
        assertThat(stats.get(0).getCount()).isEqualTo(1);
        assertThat(stats.get(0).getMetrics())
                .containsEntry("count", 7.0)
                .containsEntry("totalCost", 0.5)
                .containsEntry("totalcost", 2.0);
    }

    @Test
    @DisplayName("Default metrics follow the type prefix")
    void defaultMetricsFollowPrefix() {
        List<DailyStat> stats = statsService.getDailyStats(StatsQueryParams.builder()
                .type(List.of("cache.hit"))
                .build());

        assertThat(stats).hasSize(1);
        assertThat(stats.get(0).getMetrics()).containsOnlyKeys("durationMs");
        assertThat(stats.get(0).getMetrics().get("durationMs")).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Bucket labels for hour, week and month")
    void granularityLabels() {
        List<DailyStat> hourly = statsService.getDailyStats(StatsQueryParams.builder()
                .type(List.of("llm.completion")).groupBy("hour").metrics(List.of()).build());
        assertThat(hourly).extracting(DailyStat::getDate)
                .containsExactly("2026-03-01T10", "2026-03-01T18", "2026-03-02T09", "2026-03-02T12");

        List<DailyStat> weekly = statsService.getDailyStats(StatsQueryParams.builder()
                .type(List.of("llm.completion")).groupBy("week").metrics(List.of()).build());
        assertThat(weekly).extracting(DailyStat::getDate).containsExactly("2026-W08", "2026-W09");

        List<DailyStat> monthly = statsService.getDailyStats(StatsQueryParams.builder()
                .groupBy("month").metrics(List.of()).build());
        assertThat(monthly).hasSize(1);
        assertThat(monthly.get(0).getDate()).isEqualTo("2026-03");
        assertThat(monthly.get(0).getCount()).isEqualTo(5);
        assertThat(monthly.get(0).getMetrics()).isNull();
    }

    @Test
    @DisplayName("Breakdown splits buckets and orders missing values last")
    void breakdownByPayloadField() {
        List<DailyStat> stats = statsService.getDailyStats(StatsQueryParams.builder()
                .type(List.of("llm.completion"))
                .breakdownBy("payload.model")
                .metrics(List.of("totalTokens"))
                .build());

        assertThat(stats).extracting(DailyStat::getDate, DailyStat::getBreakdown, DailyStat::getCount)
                .containsExactly(
                        tuple("2026-03-01", "gpt-4", 2L),
                        tuple("2026-03-02", "claude", 1L),
                        tuple("2026-03-02", null, 1L));
        assertThat(stats.get(1).getMetrics()).isNull();
    }

    @Test
    @DisplayName("Source filter and column breakdown")
    void columnBreakdown() {
        List<DailyStat> stats = statsService.getDailyStats(StatsQueryParams.builder()
                .source("@kb-labs/cli")
                .groupBy("month")
                .breakdownBy("type")
                .metrics(List.of())
                .build());

        assertThat(stats).extracting(DailyStat::getBreakdown).containsExactly("cache.hit", "llm.completion");
        assertThat(stats).extracting(DailyStat::getCount).containsExactly(1L, 4L);
    }

    @Test
    @DisplayName("Summary stats and paged listing")
    void summaryAndListing() {
        EventsStatsResponse summary = statsService.getStats();
        assertThat(summary.getTotalEvents()).isEqualTo(5);
        assertThat(summary.getByType()).containsEntry("llm.completion", 4L).containsEntry("cache.hit", 1L);
        assertThat(summary.getByActor()).containsEntry("unknown", 5L);
        assertThat(summary.getTimeRange().getFrom()).isEqualTo("2026-03-01T10:15:00Z");
        assertThat(summary.getTimeRange().getTo()).isEqualTo("2026-03-02T12:00:00Z");

        EventsPageResponse page = eventQueryService.getEvents(EventsQueryParams.builder()
                .from(Instant.parse("2026-03-01T11:00:00Z"))
                .limit(2)
                .build());
        assertThat(page.getTotal()).isEqualTo(4);
        assertThat(page.isHasMore()).isTrue();
        assertThat(page.getEvents()).extracting("id").containsExactly("e5", "e3");
        assertThat(page.getEvents().get(0).getSchema()).isEqualTo("kb.v1");
        assertThat(page.getEvents().get(0).getSource().getProduct()).isEqualTo("@kb-labs/cli");
    }

    private static EventRequest event(String id, String type, String ts, Map<String, Object> payload) {
        return EventRequest.builder()
                .id(id)
                .type(type)
                .ts(Instant.parse(ts))
                .runId("run-it")
                .source(SourceDto.builder().product("@kb-labs/cli").version("1.0.0").build())
                .payload(payload)
                .build();
    }
}
