package com.kblabs.analytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/** Attribution applied to events that arrive without their own source, run id, actor or ctx. */
@Value
@Builder
@With
public class AnalyticsContext {

    Source source;
    String runId;
    Actor actor;
    Map<String, Object> ctx;

    @Value
    public static class Source {
        String product;
        String version;
    }

    @Value
    public static class Actor {
        String type;
        String id;
        String name;
    }
}
