package com.kblabs.analytics.domain.query;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Row filter shared by event listing and stats queries; null fields are not applied. */
@Value
@Builder
public class EventsFilter {

    /** Exact event types; one value becomes {@code type = ?}, several {@code type IN (...)}. */
    List<String> types;
    /** Matched against the product column. */
    String source;
    /** Matched against actor_id. */
    String actor;
    /** Inclusive lower bound on ts. */
    Instant from;
    /** Inclusive upper bound on ts. */
    Instant to;

    public static EventsFilter none() {
        return EventsFilter.builder().build();
    }

    public boolean hasTypes() {
        return types != null && !types.isEmpty();
    }
}
