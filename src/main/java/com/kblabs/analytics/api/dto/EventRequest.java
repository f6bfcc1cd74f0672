package com.kblabs.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** Incoming kb.v1 event; id, ts and attribution are filled from the analytics context when missing. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Analytics event payload for ingestion")
public class EventRequest {

    @Size(max = 128, message = "id must be at most 128 characters")
    @Schema(description = "Event id; generated when absent", example = "0b6c2f9e-5a47-4f0e-9a2c-1d7e3c0f9b11")
    private String id;

    @NotBlank(message = "type is required")
    @Size(max = 256, message = "type must be at most 256 characters")
    @Schema(description = "Dot-namespaced event type", example = "llm.completion")
    private String type;

    @Schema(description = "Event time (ISO-8601); ingestion time when absent", example = "2026-03-01T12:00:00Z")
    private Instant ts;

    @Schema(description = "Run identifier", example = "run-1772366400000")
    private String runId;

    @Valid
    @Schema(description = "Source attribution")
    private SourceDto source;

    @Schema(description = "Actor attribution")
    private ActorDto actor;

    @Schema(description = "Free-form context document", example = "{\"sessionId\": \"s-1\"}")
    private Map<String, Object> ctx;

    @Schema(description = "Event properties", example = "{\"model\": \"gpt-4\", \"totalTokens\": 1000, \"totalCost\": 0.05}")
    private Map<String, Object> payload;
}
