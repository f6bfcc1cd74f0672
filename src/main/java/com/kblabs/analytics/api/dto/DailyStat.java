package com.kblabs.analytics.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** One time bucket (optionally one breakdown value within it). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Aggregation for a time bucket")
public class DailyStat {

    @Schema(description = "Bucket label", example = "2026-03-01")
    private String date;

    @Schema(description = "Events in the bucket", example = "42")
    private long count;

    @Schema(description = "Summed payload metrics; absent when every metric is null", example = "{\"totalTokens\": 2500}")
    private Map<String, Double> metrics;

    @Schema(description = "Breakdown value", example = "gpt-4")
    private String breakdown;
}
