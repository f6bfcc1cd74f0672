package com.kblabs.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Overall counts by type, source product and actor. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary of stored events")
public class EventsStatsResponse {

    @Schema(example = "15234")
    private long totalEvents;

    private Map<String, Long> byType;

    private Map<String, Long> bySource;

    private Map<String, Long> byActor;

    private TimeRange timeRange;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Oldest and newest event time")
    public static class TimeRange {
        @Schema(example = "2026-03-01T00:00:00Z")
        private String from;
        @Schema(example = "2026-03-31T23:59:59Z")
        private String to;
    }
}
