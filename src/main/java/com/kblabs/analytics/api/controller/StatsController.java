package com.kblabs.analytics.api.controller;

import com.kblabs.analytics.api.dto.BufferStatusResponse;
import com.kblabs.analytics.api.dto.DailyStat;
import com.kblabs.analytics.api.dto.EventsStatsResponse;
import com.kblabs.analytics.api.dto.StatsQueryParams;
import com.kblabs.analytics.domain.service.StatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/** GET /stats, /stats/daily, /stats/buffer. */
@Slf4j
@RestController
@RequestMapping("/stats")
@RequiredArgsConstructor
@Tag(name = "Stats", description = "Aggregated event statistics")
public class StatsController {

    private final StatsService statsService;

    @GetMapping
    @Operation(summary = "Get summary stats", description = "Total events with counts by type, source and actor")
    public ResponseEntity<EventsStatsResponse> getStats() {
        return ResponseEntity.ok(statsService.getStats());
    }

    /** Time-bucketed counts and payload metric sums, optionally split by a dot-path. */
    @GetMapping("/daily")
    @Operation(summary = "Get time-series stats",
            description = "Buckets events by hour/day/week/month, sums payload metrics and optionally breaks down by a field path")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Stats retrieved successfully"),
            @ApiResponse(responseCode = "400", description = "Unknown granularity, unsafe field path or invalid parameter")
    })
    public ResponseEntity<List<DailyStat>> getDailyStats(
            @Parameter(description = "Event type filter; repeat for several", example = "llm.completion")
            @RequestParam(value = "type", required = false) List<String> type,

            @Parameter(description = "Source product", example = "@kb-labs/cli")
            @RequestParam(value = "source", required = false) String source,

            @Parameter(description = "Actor id", example = "u-42")
            @RequestParam(value = "actor", required = false) String actor,

            @Parameter(description = "Inclusive lower bound (ISO-8601)", example = "2026-03-01T00:00:00Z")
            @RequestParam(value = "from", required = false) Instant from,

            @Parameter(description = "Inclusive upper bound (ISO-8601)", example = "2026-03-31T23:59:59Z")
            @RequestParam(value = "to", required = false) Instant to,

            @Parameter(description = "Bucket size: hour, day, week or month", example = "day")
            @RequestParam(value = "groupBy", required = false, defaultValue = "day") String groupBy,

            @Parameter(description = "Dot-path to break each bucket down by", example = "payload.model")
            @RequestParam(value = "breakdownBy", required = false) String breakdownBy,

            @Parameter(description = "Payload metrics to sum; repeat for several", example = "totalTokens")
            @RequestParam(value = "metrics", required = false) List<String> metrics
    ) {
        StatsQueryParams params = StatsQueryParams.builder()
                .type(type)
                .source(source)
                .actor(actor)
                .from(from)
                .to(to)
                .groupBy(groupBy)
                .breakdownBy(breakdownBy)
                .metrics(metrics)
                .build();

        return ResponseEntity.ok(statsService.getDailyStats(params));
    }

    @GetMapping("/buffer")
    @Operation(summary = "Get storage status", description = "Stored row count and oldest/newest event time")
    public ResponseEntity<BufferStatusResponse> getBufferStatus() {
        return ResponseEntity.ok(statsService.getBufferStatus());
    }
}
