package com.kblabs.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** One row of the events table (kb.v1). Rows are written once and never updated. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    private String id;
    private String schema;
    private String type;
    private Instant ts;
    private Instant ingestTs;
    private String runId;
    private String product;
    private String version;
    private String actorType;
    private String actorId;
    private String actorName;
    private String ctx;     // JSONB (as String)
    private String payload; // JSONB (as String)
}
