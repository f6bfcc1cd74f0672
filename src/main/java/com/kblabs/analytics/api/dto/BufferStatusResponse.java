package com.kblabs.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Storage status; rows are written directly, so segments is the row count and size is not tracked. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Event storage status")
public class BufferStatusResponse {

    @Schema(example = "15234")
    private long segments;

    @Schema(example = "0")
    private long totalSizeBytes;

    @Schema(example = "2026-03-01T00:00:00Z")
    private String oldestEventTs;

    @Schema(example = "2026-03-31T23:59:59Z")
    private String newestEventTs;
}
