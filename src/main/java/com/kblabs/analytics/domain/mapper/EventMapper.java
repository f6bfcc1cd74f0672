package com.kblabs.analytics.domain.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kblabs.analytics.api.dto.ActorDto;
import com.kblabs.analytics.api.dto.EventRequest;
import com.kblabs.analytics.api.dto.EventView;
import com.kblabs.analytics.api.dto.SourceDto;
import com.kblabs.analytics.domain.model.Event;
import com.kblabs.analytics.domain.query.EventsSchema;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.time.Instant;
import java.util.Map;

/** EventRequest → Event row, Event row → EventView, Kafka record value → EventRequest. MapStruct + Jackson for the JSONB documents. */
@Mapper(componentModel = "spring")
public interface EventMapper {

    /** Shared ObjectMapper for ctx/payload documents. */
    ObjectMapper JSON_MAPPER = new ObjectMapper().findAndRegisterModules();

    /** Flattens source/actor into columns and serializes ctx/payload. */
    @Mapping(target = "schema", constant = EventsSchema.SCHEMA_VERSION)
    @Mapping(target = "product", source = "request.source.product")
    @Mapping(target = "version", source = "request.source.version")
    @Mapping(target = "actorType", source = "request.actor.type")
    @Mapping(target = "actorId", source = "request.actor.id")
    @Mapping(target = "actorName", source = "request.actor.name")
    @Mapping(target = "ctx", source = "request.ctx", qualifiedByName = "toJsonString")
    @Mapping(target = "payload", source = "request.payload", qualifiedByName = "toJsonString")
    Event toEvent(EventRequest request, Instant ingestTs);

    @Mapping(target = "ts", source = "ts", qualifiedByName = "instantToString")
    @Mapping(target = "ingestTs", source = "event", qualifiedByName = "ingestTsOrTs")
    @Mapping(target = "source", source = "event", qualifiedByName = "toSource")
    @Mapping(target = "actor", source = "event", qualifiedByName = "toActor")
    @Mapping(target = "ctx", source = "ctx", qualifiedByName = "parseJsonObject")
    @Mapping(target = "payload", source = "payload", qualifiedByName = "parseJson")
    EventView toView(Event event);

    /** Returns the value as-is when it is already an EventRequest, otherwise converts the Map form. */
    default EventRequest fromRecordValue(Object value) {
        if (value instanceof EventRequest eventRequest) {
            return eventRequest;
        }
        return JSON_MAPPER.convertValue(value, EventRequest.class);
    }

    @Named("instantToString")
    default String instantToString(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    /** Rows written without ingest_ts report the event time. */
    @Named("ingestTsOrTs")
    default String ingestTsOrTs(Event event) {
        return instantToString(event.getIngestTs() != null ? event.getIngestTs() : event.getTs());
    }

    @Named("toSource")
    default SourceDto toSource(Event event) {
        return SourceDto.builder()
                .product(event.getProduct() != null ? event.getProduct() : "")
                .version(event.getVersion() != null ? event.getVersion() : "")
                .build();
    }

    /** No actor_type means no actor. */
    @Named("toActor")
    default ActorDto toActor(Event event) {
        if (event.getActorType() == null) {
            return null;
        }
        return ActorDto.builder()
                .type(event.getActorType())
                .id(event.getActorId())
                .name(event.getActorName())
                .build();
    }

    /** Map/List → JSON text for a JSONB column. */
    @Named("toJsonString")
    default String toJsonString(Object obj) {
        if (obj == null) return null;
        try {
            return JSON_MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event document is not serializable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Named("parseJsonObject")
    default Map<String, Object> parseJsonObject(String json) {
        if (json == null) return null;
        try {
            return JSON_MAPPER.readValue(json, new TypeReference<Map<String, Object>>() { });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored ctx is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    @Named("parseJson")
    default Object parseJson(String json) {
        if (json == null) return null;
        try {
            return JSON_MAPPER.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
