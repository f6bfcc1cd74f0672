package com.kblabs.analytics.domain.query;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Time-series stats request: filter, bucket size, optional breakdown dimension and metric names. */
@Value
@Builder
public class DailyStatsQuery {

    EventsFilter filter;
    /** Defaults to DAY when null. */
    Granularity groupBy;
    /** Dot-path splitting each bucket into sub-groups. */
    String breakdownBy;
    /** Null means "defaults for the type filter"; an empty list projects no metrics. */
    List<String> metrics;
}
