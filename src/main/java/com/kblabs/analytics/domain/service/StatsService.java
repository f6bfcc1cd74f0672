package com.kblabs.analytics.domain.service;

import com.kblabs.analytics.api.dto.BufferStatusResponse;
import com.kblabs.analytics.api.dto.DailyStat;
import com.kblabs.analytics.api.dto.EventsStatsResponse;
import com.kblabs.analytics.api.dto.StatsQueryParams;
import com.kblabs.analytics.domain.query.CompiledStatsQuery;
import com.kblabs.analytics.domain.query.DailyStatsQuery;
import com.kblabs.analytics.domain.query.DailyStatsQueryBuilder;
import com.kblabs.analytics.domain.query.EventsFilter;
import com.kblabs.analytics.domain.query.Granularity;
import com.kblabs.analytics.infrastructure.persistence.StatsJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/** Summary counts, storage status and compiled time-series stats over the events table. */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatsService {

    private final StatsJdbcRepository statsRepository;
    private final DailyStatsQueryBuilder queryBuilder;

    /** Totals plus counts by type, source and actor; an empty table reports "now" for both bounds. */
    public EventsStatsResponse getStats() {
        StatsJdbcRepository.Totals totals = statsRepository.queryTotals();
        String now = Instant.now().toString();

        return EventsStatsResponse.builder()
                .totalEvents(totals.getTotal())
                .byType(statsRepository.countByType())
                .bySource(statsRepository.countBySource())
                .byActor(statsRepository.countByActor())
                .timeRange(EventsStatsResponse.TimeRange.builder()
                        .from(totals.getOldest() != null ? totals.getOldest().toString() : now)
                        .to(totals.getNewest() != null ? totals.getNewest().toString() : now)
                        .build())
                .build();
    }

    /** Compiles the request (throws InvalidGranularityException / UnsafePathSegmentException) and runs it. */
    public List<DailyStat> getDailyStats(StatsQueryParams params) {
        log.debug("Querying daily stats: type={}, groupBy={}, breakdownBy={}, metrics={}",
                params.getType(), params.getGroupBy(), params.getBreakdownBy(), params.getMetrics());

        DailyStatsQuery query = DailyStatsQuery.builder()
                .filter(EventsFilter.builder()
                        .types(params.getType())
                        .source(params.getSource())
                        .actor(params.getActor())
                        .from(params.getFrom())
                        .to(params.getTo())
                        .build())
                .groupBy(params.getGroupBy() != null ? Granularity.fromKey(params.getGroupBy()) : Granularity.DAY)
                .breakdownBy(blankToNull(params.getBreakdownBy()))
                .metrics(params.getMetrics())
                .build();

        CompiledStatsQuery compiled = queryBuilder.build(query);
        return statsRepository.queryDailyStats(compiled);
    }

    public BufferStatusResponse getBufferStatus() {
        return statsRepository.queryBufferStatus();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
