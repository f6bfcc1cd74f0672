package com.kblabs.analytics.config;

import com.kblabs.analytics.infrastructure.persistence.SchemaJdbcRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates the events table, its indexes and helper function; a no-op on an initialized database.
 * Runs during bean initialization so the table exists before the Kafka listener containers start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventSchemaInitializer {

    private final SchemaJdbcRepository schemaRepository;

    @PostConstruct
    void applySchema() {
        int statements = schemaRepository.applySchema();
        log.info("Events schema ensured ({} DDL statements)", statements);
    }
}
