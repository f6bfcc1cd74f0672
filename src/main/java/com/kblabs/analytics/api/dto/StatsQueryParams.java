package com.kblabs.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/** GET /stats/daily parameters: the events filter plus bucketing, breakdown and metrics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Query parameters for time-series stats")
public class StatsQueryParams {

    @Schema(description = "Event types (exact match); also selects the default metrics", example = "[\"llm.completion\"]")
    private List<String> type;

    @Schema(description = "Source product", example = "@kb-labs/cli")
    private String source;

    @Schema(description = "Actor id", example = "u-42")
    private String actor;

    @Schema(description = "Inclusive lower bound on event time", example = "2026-03-01T00:00:00Z")
    private Instant from;

    @Schema(description = "Inclusive upper bound on event time", example = "2026-03-31T23:59:59Z")
    private Instant to;

    @Schema(description = "Bucket size: hour, day, week or month. Default: day", example = "day")
    private String groupBy;

    @Schema(description = "Dot-path splitting each bucket", example = "payload.model")
    private String breakdownBy;

    @Schema(description = "Payload metrics to sum; defaults depend on the type filter", example = "[\"totalTokens\", \"totalCost\"]")
    private List<String> metrics;
}
