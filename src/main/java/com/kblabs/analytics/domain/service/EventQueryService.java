package com.kblabs.analytics.domain.service;

import com.kblabs.analytics.api.dto.EventView;
import com.kblabs.analytics.api.dto.EventsPageResponse;
import com.kblabs.analytics.api.dto.EventsQueryParams;
import com.kblabs.analytics.config.AppProperties;
import com.kblabs.analytics.domain.mapper.EventMapper;
import com.kblabs.analytics.domain.query.EventsFilter;
import com.kblabs.analytics.domain.query.EventsFilterClause;
import com.kblabs.analytics.domain.query.SqlFragment;
import com.kblabs.analytics.infrastructure.persistence.EventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/** Filtered, paged event listing with total count. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventQueryService {

    private final EventJdbcRepository eventRepository;
    private final EventMapper eventMapper;
    private final AppProperties appProperties;

    public EventsPageResponse getEvents(EventsQueryParams params) {
        AppProperties.QueryProperties limits = appProperties.getQuery();
        int limit = params.getLimit() != null
                ? Math.min(params.getLimit(), limits.getMaxLimit())
                : limits.getDefaultLimit();
        int offset = params.getOffset() != null ? params.getOffset() : 0;

        SqlFragment where = EventsFilterClause.build(EventsFilter.builder()
                .types(params.getType())
                .source(params.getSource())
                .actor(params.getActor())
                .from(params.getFrom())
                .to(params.getTo())
                .build());
        log.debug("Listing events: filter=[{}], limit={}, offset={}", where.getSql(), limit, offset);

        long total = eventRepository.count(where);
        List<EventView> events = eventRepository.findPage(where, limit, offset).stream()
                .map(eventMapper::toView)
                .toList();

        return EventsPageResponse.builder()
                .events(events)
                .total(total)
                .hasMore(offset + events.size() < total)
                .build();
    }
}
