package com.kblabs.analytics.domain.query;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Turns an {@link EventsFilter} into a WHERE body joined with AND; all caller values are bind parameters. */
public final class EventsFilterClause {

    private EventsFilterClause() {
    }

    public static SqlFragment build(EventsFilter filter) {
        if (filter == null) {
            return SqlFragment.empty();
        }

        List<String> clauses = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (filter.hasTypes()) {
            List<String> types = filter.getTypes();
            if (types.size() == 1) {
                clauses.add("type = ?");
            } else {
                clauses.add("type IN (" + String.join(", ", Collections.nCopies(types.size(), "?")) + ")");
            }
            params.addAll(types);
        }

        if (filter.getSource() != null) {
            clauses.add("product = ?");
            params.add(filter.getSource());
        }

        if (filter.getActor() != null) {
            clauses.add("actor_id = ?");
            params.add(filter.getActor());
        }

        if (filter.getFrom() != null) {
            clauses.add("ts >= ?");
            params.add(Timestamp.from(filter.getFrom()));
        }

        if (filter.getTo() != null) {
            clauses.add("ts <= ?");
            params.add(Timestamp.from(filter.getTo()));
        }

        return new SqlFragment(String.join(" AND ", clauses), List.copyOf(params));
    }

    /** {@code " WHERE ..."} or an empty string when nothing is filtered. */
    public static String whereClause(SqlFragment fragment) {
        return fragment.isEmpty() ? "" : " WHERE " + fragment.getSql();
    }
}
