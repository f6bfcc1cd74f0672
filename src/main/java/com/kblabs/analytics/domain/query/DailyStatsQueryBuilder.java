package com.kblabs.analytics.domain.query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the time-series statement from the resolver, metrics and bucketing fragments.
 *
 * <pre>
 * SELECT &lt;label&gt; AS "date", COUNT(*) AS "count", &lt;metrics&gt;[, &lt;breakdown&gt; AS "breakdown"]
 * FROM events [WHERE ...]
 * GROUP BY &lt;bucket&gt;[, &lt;breakdown&gt;]
 * ORDER BY &lt;bucket&gt; ASC[, &lt;breakdown&gt; ASC NULLS LAST]
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailyStatsQueryBuilder {

    private final FieldPathResolver pathResolver;
    private final MetricsSelectBuilder metricsSelectBuilder;
    private final TimeBucketing timeBucketing;

    public CompiledStatsQuery build(DailyStatsQuery query) {
        Granularity granularity = query.getGroupBy() != null ? query.getGroupBy() : Granularity.DAY;
        EventsFilter filter = query.getFilter() != null ? query.getFilter() : EventsFilter.none();

        List<String> metricNames = query.getMetrics() != null
                ? List.copyOf(query.getMetrics())
                : metricsSelectBuilder.defaultMetrics(filter.getTypes());
        List<String> metricsSelect = metricsSelectBuilder.buildMetricsSelect(metricNames);

        String breakdownSql = query.getBreakdownBy() != null
                ? pathResolver.resolvePath(query.getBreakdownBy())
                : null;

        String bucket = timeBucketing.bucketExpression(granularity);

        List<String> selectParts = new ArrayList<>();
        selectParts.add(timeBucketing.labelExpression(granularity) + " AS \"" + CompiledStatsQuery.DATE_ALIAS + "\"");
        selectParts.add("COUNT(*) AS \"" + CompiledStatsQuery.COUNT_ALIAS + "\"");
        selectParts.addAll(metricsSelect);
        if (breakdownSql != null) {
            selectParts.add(breakdownSql + " AS \"" + CompiledStatsQuery.BREAKDOWN_ALIAS + "\"");
        }

        List<String> groupByParts = new ArrayList<>();
        groupByParts.add(bucket);
        if (breakdownSql != null) {
            groupByParts.add(breakdownSql);
        }

        SqlFragment where = EventsFilterClause.build(filter);

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", selectParts))
                .append(" FROM ").append(EventsSchema.TABLE)
                .append(EventsFilterClause.whereClause(where))
                .append(" GROUP BY ").append(String.join(", ", groupByParts))
                .append(" ORDER BY ").append(bucket).append(" ASC");
        if (breakdownSql != null) {
            // by expression: a metric may also be aliased "breakdown"
            sql.append(", ").append(breakdownSql).append(" ASC NULLS LAST");
        }

        log.debug("Compiled stats query: groupBy={}, breakdownBy={}, metrics={}",
                granularity.getKey(), query.getBreakdownBy(), metricNames);
        return new CompiledStatsQuery(sql.toString(), where.getParams(), metricNames, breakdownSql != null);
    }
}
