package com.kblabs.analytics.domain.service;

import com.kblabs.analytics.api.dto.EventRequest;
import com.kblabs.analytics.domain.mapper.EventMapper;
import com.kblabs.analytics.domain.model.Event;
import com.kblabs.analytics.infrastructure.persistence.EventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Consumer side: maps a batch to rows and appends it in one transaction. Duplicate ids are skipped by the insert. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventIngestionService {

    private final EventJdbcRepository eventRepository;
    private final EventMapper eventMapper;

    /** Returns how many events were new. */
    @Transactional
    public int processBatch(List<EventRequest> events) {
        if (events.isEmpty()) {
            return 0;
        }

        // Same id twice in one batch: keep the first
        Map<String, EventRequest> byId = new LinkedHashMap<>();
        for (EventRequest event : events) {
            byId.putIfAbsent(event.getId(), event);
        }

        Instant ingestTs = Instant.now();
        List<Event> rows = byId.values().stream()
                .map(event -> eventMapper.toEvent(event, ingestTs))
                .toList();

        int inserted = eventRepository.batchInsert(rows);
        log.info("Processed batch: {} new events inserted, {} duplicates skipped",
                inserted, events.size() - inserted);
        return inserted;
    }
}
