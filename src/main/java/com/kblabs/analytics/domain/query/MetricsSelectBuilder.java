package com.kblabs.analytics.domain.query;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Aggregate projections for payload metrics:
 * {@code SUM(try_cast_double(jsonb_path_query_first(payload, '$.totalCost') #>> '{}')) AS "totalCost"}.
 *
 * <p>Values that do not cast to a number contribute NULL, so SUM skips them. Duplicate names are
 * passed through as-is; uniqueness is the caller's concern.
 */
@Component
@RequiredArgsConstructor
public class MetricsSelectBuilder {

    private static final String PAYLOAD_COLUMN = "payload";

    private final DefaultMetricsCatalog catalog;

    /** Default metric names for a single type; null means no filter. */
    public List<String> defaultMetrics(String type) {
        return type == null ? catalog.metricsFor(null) : catalog.metricsFor(List.of(type));
    }

    public List<String> defaultMetrics(Collection<String> types) {
        return catalog.metricsFor(types);
    }

    /** One fragment per metric name, same order. Empty input gives an empty list. */
    public List<String> buildMetricsSelect(List<String> metricNames) {
        return metricNames.stream()
                .map(this::metricExpression)
                .toList();
    }

    /** SUM over the numeric value of {@code payload.<metric>}, aliased to the metric name. */
    public String metricExpression(String metric) {
        List<String> segments = Arrays.asList(metric.split("\\.", -1));
        String extraction = JsonPathExpressions.extractText(PAYLOAD_COLUMN, segments, metric);
        return "SUM(" + EventsSchema.TRY_CAST_DOUBLE + "(" + extraction + ")) AS \"" + metric + "\"";
    }
}
