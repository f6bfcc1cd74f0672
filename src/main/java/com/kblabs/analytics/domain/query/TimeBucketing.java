package com.kblabs.analytics.domain.query;

import org.springframework.stereotype.Component;

/** date_trunc / to_char fragments for grouping events on {@code ts}. */
@Component
public class TimeBucketing {

    private static final String TIME_COLUMN = "ts";

    public String truncUnit(String granularity) {
        return Granularity.fromKey(granularity).getTruncUnit();
    }

    public String displayFormat(String granularity) {
        return Granularity.fromKey(granularity).getDisplayFormat();
    }

    /** {@code date_trunc('day', ts)}; used in GROUP BY and ORDER BY. */
    public String bucketExpression(Granularity granularity) {
        return "date_trunc('" + granularity.getTruncUnit() + "', " + TIME_COLUMN + ")";
    }

    /** {@code to_char(date_trunc('day', ts), 'YYYY-MM-DD')}; the bucket label. */
    public String labelExpression(Granularity granularity) {
        return "to_char(" + bucketExpression(granularity) + ", '" + granularity.getDisplayFormat() + "')";
    }
}
