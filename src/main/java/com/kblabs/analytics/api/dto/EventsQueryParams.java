package com.kblabs.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/** GET /events filter and paging; limit/offset defaults come from app.query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Query parameters for the events listing")
public class EventsQueryParams {

    @Schema(description = "Event types (exact match)", example = "[\"llm.completion\"]")
    private List<String> type;

    @Schema(description = "Source product", example = "@kb-labs/cli")
    private String source;

    @Schema(description = "Actor id", example = "u-42")
    private String actor;

    @Schema(description = "Inclusive lower bound on event time", example = "2026-03-01T00:00:00Z")
    private Instant from;

    @Schema(description = "Inclusive upper bound on event time", example = "2026-03-31T23:59:59Z")
    private Instant to;

    @Schema(description = "Page size", example = "100")
    private Integer limit;

    @Schema(description = "Rows to skip", example = "0")
    private Integer offset;
}
