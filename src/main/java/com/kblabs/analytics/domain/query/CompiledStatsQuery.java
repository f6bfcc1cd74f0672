package com.kblabs.analytics.domain.query;

import lombok.Value;

import java.util.List;

/** Executable stats statement plus what the row mapper needs to read it back. */
@Value
public class CompiledStatsQuery {

    public static final String DATE_ALIAS = "date";
    public static final String COUNT_ALIAS = "count";
    public static final String BREAKDOWN_ALIAS = "breakdown";

    /** 1-based result positions: date, count, then metrics in order, then the breakdown. */
    public static final int DATE_COLUMN = 1;
    public static final int COUNT_COLUMN = 2;
    private static final int FIRST_METRIC_COLUMN = 3;

    String sql;
    List<Object> params;
    List<String> metricNames;
    boolean breakdown;

    /** Result position of the metric at {@code index} in {@link #getMetricNames()}. */
    public int metricColumn(int index) {
        return FIRST_METRIC_COLUMN + index;
    }

    public int breakdownColumn() {
        return FIRST_METRIC_COLUMN + metricNames.size();
    }

    public Object[] paramsArray() {
        return params.toArray();
    }
}
