package com.kblabs.analytics.domain.service;

import com.kblabs.analytics.api.dto.ActorDto;
import com.kblabs.analytics.api.dto.EventRequest;
import com.kblabs.analytics.api.dto.SourceDto;
import com.kblabs.analytics.domain.model.AnalyticsContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Fills what the caller left out before an event is published: id, ts and the attribution from the
 * current analytics context. Done on the producer side so a redelivered message keeps its id.
 */
@Component
@RequiredArgsConstructor
public class EventEnricher {

    private final AnalyticsContextHolder contextHolder;

    public EventRequest enrich(EventRequest event) {
        AnalyticsContext context = contextHolder.current();
        EventRequest.EventRequestBuilder enriched = event.toBuilder();

        if (event.getId() == null || event.getId().isBlank()) {
            enriched.id(UUID.randomUUID().toString());
        }
        if (event.getTs() == null) {
            enriched.ts(Instant.now());
        }
        if (event.getSource() == null && context.getSource() != null) {
            enriched.source(SourceDto.builder()
                    .product(context.getSource().getProduct())
                    .version(context.getSource().getVersion())
                    .build());
        }
        if (event.getRunId() == null) {
            enriched.runId(context.getRunId());
        }
        if (event.getActor() == null && context.getActor() != null) {
            enriched.actor(ActorDto.builder()
                    .type(context.getActor().getType())
                    .id(context.getActor().getId())
                    .name(context.getActor().getName())
                    .build());
        }
        if (event.getCtx() == null && context.getCtx() != null) {
            enriched.ctx(context.getCtx());
        }
        return enriched.build();
    }
}
