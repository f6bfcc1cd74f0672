package com.kblabs.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Page of events, newest first")
public class EventsPageResponse {

    private List<EventView> events;

    @Schema(description = "Number of events matching the filter", example = "1523")
    private long total;

    @Schema(description = "True when offset + page size is below total", example = "true")
    private boolean hasMore;
}
