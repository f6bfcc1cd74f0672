package com.kblabs.analytics.api.controller;

import com.kblabs.analytics.api.dto.BulkEventRequest;
import com.kblabs.analytics.api.dto.EventRequest;
import com.kblabs.analytics.api.dto.EventResponse;
import com.kblabs.analytics.api.dto.EventsPageResponse;
import com.kblabs.analytics.api.dto.EventsQueryParams;
import com.kblabs.analytics.api.dto.IdentifyRequest;
import com.kblabs.analytics.domain.service.EventQueryService;
import com.kblabs.analytics.domain.service.EventTrackingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/** POST /events, /events/bulk, /events/identify publish to Kafka and answer 202; GET /events lists stored events. */
@Slf4j
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
@Validated
@Tag(name = "Events", description = "Event ingestion and listing")
public class EventController {

    private final EventTrackingService trackingService;
    private final EventQueryService queryService;

    /** Validates, enriches and queues one event. Invalid payload → 400, accepted → 202. */
    @PostMapping
    @Operation(summary = "Track a single event", description = "Accepts and queues a single event for async storage")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Event accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid event payload"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable (Kafka down)")
    })
    public ResponseEntity<EventResponse> trackEvent(@Valid @RequestBody EventRequest event) throws Exception {
        log.debug("Received event: type={}", event.getType());

        trackingService.track(event);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(EventResponse.builder()
                        .status("accepted")
                        .acceptedCount(1)
                        .message("Event queued for processing")
                        .build());
    }

    @PostMapping("/bulk")
    @Operation(summary = "Track events in bulk", description = "Accepts up to 1000 events for async storage")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Events accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid event payload(s)"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable")
    })
    public ResponseEntity<EventResponse> trackBulkEvents(@Valid @RequestBody BulkEventRequest bulkRequest) throws Exception {
        log.debug("Received bulk request with {} events", bulkRequest.getEvents().size());

        trackingService.trackBatch(bulkRequest.getEvents());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(EventResponse.builder()
                        .status("accepted")
                        .acceptedCount(bulkRequest.getEvents().size())
                        .message("Events queued for processing")
                        .build());
    }

    @PostMapping("/identify")
    @Operation(summary = "Identify a user", description = "Queues an 'identity' event carrying the user id and traits")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Identity event accepted"),
            @ApiResponse(responseCode = "400", description = "Missing userId")
    })
    public ResponseEntity<EventResponse> identify(@Valid @RequestBody IdentifyRequest request) throws Exception {
        trackingService.identify(request.getUserId(), request.getTraits());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(EventResponse.builder()
                        .status("accepted")
                        .acceptedCount(1)
                        .message("Identity event queued for processing")
                        .build());
    }

    /** Newest first; type may repeat. */
    @GetMapping
    @Operation(summary = "List events", description = "Filtered, paged listing of stored events, newest first")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Events retrieved"),
            @ApiResponse(responseCode = "400", description = "Invalid query parameters")
    })
    public ResponseEntity<EventsPageResponse> getEvents(
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

            @Parameter(description = "Page size (default 100)", example = "100")
            @RequestParam(value = "limit", required = false) @Min(1) @Max(1000) Integer limit,

            @Parameter(description = "Rows to skip", example = "0")
            @RequestParam(value = "offset", required = false) @Min(0) Integer offset
    ) {
        EventsQueryParams params = EventsQueryParams.builder()
                .type(type)
                .source(source)
                .actor(actor)
                .from(from)
                .to(to)
                .limit(limit)
                .offset(offset)
                .build();

        return ResponseEntity.ok(queryService.getEvents(params));
    }
}
