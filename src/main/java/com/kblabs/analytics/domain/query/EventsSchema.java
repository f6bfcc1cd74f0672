package com.kblabs.analytics.domain.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical layout of the kb.v1 events table: columns, indexes and the DDL derived from them.
 *
 * <p>Every statement is guarded ({@code IF NOT EXISTS} / {@code OR REPLACE}) so the whole set can be
 * re-applied against an initialized database without error.
 */
public final class EventsSchema {

    public static final String TABLE = "events";
    public static final String SCHEMA_VERSION = "kb.v1";

    /** Failure-tolerant numeric cast used by metric projections; NULL instead of an error. */
    public static final String TRY_CAST_DOUBLE = "try_cast_double";

    public static final List<Column> COLUMNS = List.of(
            Column.primaryKey("id", "VARCHAR"),
            Column.required("schema", "VARCHAR", "'" + SCHEMA_VERSION + "'"),
            Column.required("type", "VARCHAR", null),
            Column.required("ts", "TIMESTAMPTZ", null),
            Column.optional("ingest_ts", "TIMESTAMPTZ"),
            Column.optional("run_id", "VARCHAR"),
            Column.optional("product", "VARCHAR"),
            Column.optional("version", "VARCHAR"),
            Column.optional("actor_type", "VARCHAR"),
            Column.optional("actor_id", "VARCHAR"),
            Column.optional("actor_name", "VARCHAR"),
            Column.optional("ctx", "JSONB"),
            Column.optional("payload", "JSONB")
    );

    // (type, ts) serves the dominant "all events of type X over a time range" pattern.
    public static final List<Index> INDEXES = List.of(
            new Index("events_ts_idx", List.of("ts")),
            new Index("events_type_idx", List.of("type")),
            new Index("events_product_idx", List.of("product")),
            new Index("events_type_ts_idx", List.of("type", "ts"))
    );

    private static final String CREATE_TRY_CAST_FUNCTION = """
            CREATE OR REPLACE FUNCTION %s(value text) RETURNS double precision
            LANGUAGE plpgsql IMMUTABLE AS $$
            BEGIN
                RETURN value::double precision;
            EXCEPTION WHEN invalid_text_representation OR numeric_value_out_of_range THEN
                RETURN NULL;
            END;
            $$""".formatted(TRY_CAST_DOUBLE);

    private EventsSchema() {
    }

    /** CREATE TABLE IF NOT EXISTS built from {@link #COLUMNS}. */
    public static String createTableStatement() {
        String columns = COLUMNS.stream()
                .map(Column::toDdl)
                .collect(Collectors.joining(",\n  "));
        return "CREATE TABLE IF NOT EXISTS " + TABLE + " (\n  " + columns + "\n)";
    }

    public static List<String> createIndexStatements() {
        return INDEXES.stream()
                .map(Index::toDdl)
                .toList();
    }

    public static String createTryCastFunctionStatement() {
        return CREATE_TRY_CAST_FUNCTION;
    }

    /** Full DDL in execution order: table, indexes, helper function. */
    public static List<String> ddlStatements() {
        List<String> statements = new ArrayList<>();
        statements.add(createTableStatement());
        statements.addAll(createIndexStatements());
        statements.add(createTryCastFunctionStatement());
        return List.copyOf(statements);
    }

    public static List<String> columnNames() {
        return COLUMNS.stream()
                .map(Column::getName)
                .toList();
    }

    @Value
    public static class Column {
        String name;
        String sqlType;
        boolean nullable;
        boolean primaryKey;
        String defaultValue;

        static Column primaryKey(String name, String sqlType) {
            return new Column(name, sqlType, false, true, null);
        }

        static Column required(String name, String sqlType, String defaultValue) {
            return new Column(name, sqlType, false, false, defaultValue);
        }

        static Column optional(String name, String sqlType) {
            return new Column(name, sqlType, true, false, null);
        }

        String toDdl() {
            StringBuilder ddl = new StringBuilder(name).append(' ').append(sqlType);
            if (primaryKey) {
                ddl.append(" PRIMARY KEY");
            } else if (!nullable) {
                ddl.append(" NOT NULL");
            }
            if (defaultValue != null) {
                ddl.append(" DEFAULT ").append(defaultValue);
            }
            return ddl.toString();
        }
    }

    @Value
    public static class Index {
        String name;
        List<String> columns;

        String toDdl() {
            return "CREATE INDEX IF NOT EXISTS " + name + " ON " + TABLE + " (" + String.join(", ", columns) + ")";
        }
    }
}
