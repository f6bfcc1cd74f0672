package com.kblabs.analytics.domain.query;

import lombok.Getter;

/** Grouping key outside hour/day/week/month. Never silently defaulted. */
@Getter
public class InvalidGranularityException extends QueryCompilationException {

    private final String granularity;

    public InvalidGranularityException(String granularity) {
        super("Invalid granularity '" + granularity + "', expected one of " + Granularity.keys());
        this.granularity = granularity;
    }
}
