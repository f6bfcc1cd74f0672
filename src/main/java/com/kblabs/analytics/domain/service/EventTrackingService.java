package com.kblabs.analytics.domain.service;

import com.kblabs.analytics.api.dto.EventRequest;
import com.kblabs.analytics.infrastructure.kafka.EventKafkaProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** API side of ingestion: enrich, then publish to Kafka. Storage happens in the consumer. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventTrackingService {

    static final String IDENTITY_EVENT_TYPE = "identity";

    private final EventEnricher eventEnricher;
    private final EventKafkaProducer kafkaProducer;

    /** Returns the id the event was published under. */
    public String track(EventRequest event) throws Exception {
        EventRequest enriched = eventEnricher.enrich(event);
        kafkaProducer.send(enriched);
        log.debug("Tracked event: id={}, type={}", enriched.getId(), enriched.getType());
        return enriched.getId();
    }

    public List<String> trackBatch(List<EventRequest> events) throws Exception {
        List<EventRequest> enriched = events.stream()
                .map(eventEnricher::enrich)
                .toList();
        kafkaProducer.sendBatch(enriched);
        return enriched.stream()
                .map(EventRequest::getId)
                .toList();
    }

    /** Records an "identity" event with payload {userId, ...traits}; a "userId" trait overrides the argument. */
    public String identify(String userId, Map<String, Object> traits) throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        if (traits != null) {
            payload.putAll(traits);
        }
        return track(EventRequest.builder()
                .type(IDENTITY_EVENT_TYPE)
                .payload(payload)
                .build());
    }
}
