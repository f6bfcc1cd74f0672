package com.kblabs.analytics.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Stored event as returned by GET /events. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Stored analytics event")
public class EventView {

    private String id;

    @Schema(example = "kb.v1")
    private String schema;

    @Schema(example = "llm.completion")
    private String type;

    @Schema(description = "Event time", example = "2026-03-01T12:00:00Z")
    private String ts;

    @Schema(description = "Ingestion time; event time when not recorded", example = "2026-03-01T12:00:01Z")
    private String ingestTs;

    private SourceDto source;

    private String runId;

    private ActorDto actor;

    private Map<String, Object> ctx;

    private Object payload;
}
