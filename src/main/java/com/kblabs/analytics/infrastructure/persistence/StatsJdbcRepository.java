package com.kblabs.analytics.infrastructure.persistence;

import com.kblabs.analytics.api.dto.BufferStatusResponse;
import com.kblabs.analytics.api.dto.DailyStat;
import com.kblabs.analytics.domain.query.CompiledStatsQuery;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregations over the events table: totals, per-dimension counts and compiled time-series queries. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class StatsJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** Row count with oldest/newest ts; bounds are null on an empty table. */
    public Totals queryTotals() {
        return jdbcTemplate.queryForObject(
                "SELECT COUNT(*) AS total, MIN(ts) AS min_ts, MAX(ts) AS max_ts FROM events",
                (rs, rowNum) -> new Totals(
                        rs.getLong("total"),
                        toInstant(rs.getTimestamp("min_ts")),
                        toInstant(rs.getTimestamp("max_ts"))));
    }

    public Map<String, Long> countByType() {
        return countBy("type");
    }

    /** Events without a product are counted under "unknown". */
    public Map<String, Long> countBySource() {
        return countBy("COALESCE(product, 'unknown')");
    }

    public Map<String, Long> countByActor() {
        return countBy("COALESCE(actor_id, 'unknown')");
    }

    /** Runs a compiled time-series statement; metrics that are all NULL in a row are left out. */
    public List<DailyStat> queryDailyStats(CompiledStatsQuery query) {
        long start = System.currentTimeMillis();
        List<DailyStat> rows = jdbcTemplate.query(query.getSql(),
                (rs, rowNum) -> mapDailyStat(rs, query), query.paramsArray());
        log.debug("Stats query returned {} rows in {}ms", rows.size(), System.currentTimeMillis() - start);
        return rows;
    }

    /**
     * Reads one stats row by column position. Metric aliases are caller-chosen and the driver matches
     * labels case-insensitively, so a metric named "count" or "Date" must not be looked up by name.
     */
    static DailyStat mapDailyStat(ResultSet rs, CompiledStatsQuery query) throws SQLException {
        List<String> metricNames = query.getMetricNames();
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (int i = 0; i < metricNames.size(); i++) {
            Object value = rs.getObject(query.metricColumn(i));
            if (value instanceof Number number) {
                metrics.put(metricNames.get(i), number.doubleValue());
            }
        }

        DailyStat.DailyStatBuilder stat = DailyStat.builder()
                .date(rs.getString(CompiledStatsQuery.DATE_COLUMN))
                .count(rs.getLong(CompiledStatsQuery.COUNT_COLUMN));
        if (!metrics.isEmpty()) {
            stat.metrics(metrics);
        }
        if (query.isBreakdown()) {
            stat.breakdown(rs.getString(query.breakdownColumn()));
        }
        return stat.build();
    }

    public BufferStatusResponse queryBufferStatus() {
        Totals totals = queryTotals();
        return BufferStatusResponse.builder()
                .segments(totals.getTotal())
                .totalSizeBytes(0)
                .oldestEventTs(totals.getOldest() != null ? totals.getOldest().toString() : null)
                .newestEventTs(totals.getNewest() != null ? totals.getNewest().toString() : null)
                .build();
    }

    private Map<String, Long> countBy(String expression) {
        String sql = "SELECT " + expression + " AS grp, COUNT(*) AS cnt FROM events GROUP BY grp ORDER BY grp";
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbcTemplate.query(sql, rs -> {
            counts.put(rs.getString("grp"), rs.getLong("cnt"));
        });
        return counts;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    @Value
    public static class Totals {
        long total;
        Instant oldest;
        Instant newest;
    }
}
