package com.kblabs.analytics.infrastructure.persistence;

import com.kblabs.analytics.domain.query.EventsSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/** Runs the events DDL. Every statement is guarded, so repeated runs are no-ops. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SchemaJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** Executes {@link EventsSchema#ddlStatements()} in order; returns how many statements ran. */
    public int applySchema() {
        List<String> statements = EventsSchema.ddlStatements();
        for (String statement : statements) {
            log.debug("Executing DDL: {}", statement);
            jdbcTemplate.execute(statement);
        }
        return statements.size();
    }
}
