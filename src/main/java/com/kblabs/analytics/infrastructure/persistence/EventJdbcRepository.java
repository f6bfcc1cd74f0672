package com.kblabs.analytics.infrastructure.persistence;

import com.kblabs.analytics.domain.model.Event;
import com.kblabs.analytics.domain.query.EventsFilterClause;
import com.kblabs.analytics.domain.query.SqlFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** events table: batched append-only insert (ON CONFLICT (id) DO NOTHING) and filtered listing. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
            INSERT INTO events (id, schema, type, ts, ingest_ts, run_id, product, version,
                                actor_type, actor_id, actor_name, ctx, payload)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb)
            ON CONFLICT (id) DO NOTHING
            """;

    private static final RowMapper<Event> EVENT_ROW_MAPPER = EventJdbcRepository::mapEvent;

    /** Inserts the batch; rows whose id already exists are skipped. Returns the number of new rows. */
    public int batchInsert(List<Event> events) {
        if (events.isEmpty()) {
            return 0;
        }
        int[][] results = jdbcTemplate.batchUpdate(INSERT_SQL, events, events.size(),
                (ps, event) -> {
                    ps.setString(1, event.getId());
                    ps.setString(2, event.getSchema());
                    ps.setString(3, event.getType());
                    ps.setTimestamp(4, Timestamp.from(event.getTs()));
                    if (event.getIngestTs() != null) {
                        ps.setTimestamp(5, Timestamp.from(event.getIngestTs()));
                    } else {
                        ps.setNull(5, Types.TIMESTAMP_WITH_TIMEZONE);
                    }
                    ps.setString(6, event.getRunId());
                    ps.setString(7, event.getProduct());
                    ps.setString(8, event.getVersion());
                    ps.setString(9, event.getActorType());
                    ps.setString(10, event.getActorId());
                    ps.setString(11, event.getActorName());
                    if (event.getCtx() != null) {
                        ps.setString(12, event.getCtx());
                    } else {
                        ps.setNull(12, Types.OTHER);
                    }
                    if (event.getPayload() != null) {
                        ps.setString(13, event.getPayload());
                    } else {
                        ps.setNull(13, Types.OTHER);
                    }
                });
        return (int) Arrays.stream(results)
                .flatMapToInt(Arrays::stream)
                .filter(count -> count > 0)
                .count();
    }

    /** Matching rows, newest first. */
    public List<Event> findPage(SqlFragment filter, int limit, int offset) {
        String sql = "SELECT * FROM events" + EventsFilterClause.whereClause(filter)
                + " ORDER BY ts DESC LIMIT ? OFFSET ?";
        List<Object> params = new ArrayList<>(filter.getParams());
        params.add(limit);
        params.add(offset);
        return jdbcTemplate.query(sql, EVENT_ROW_MAPPER, params.toArray());
    }

    public long count(SqlFragment filter) {
        String sql = "SELECT COUNT(*) FROM events" + EventsFilterClause.whereClause(filter);
        Long total = jdbcTemplate.queryForObject(sql, Long.class, filter.paramsArray());
        return total != null ? total : 0L;
    }

    private static Event mapEvent(ResultSet rs, int rowNum) throws SQLException {
        Timestamp ingestTs = rs.getTimestamp("ingest_ts");
        return Event.builder()
                .id(rs.getString("id"))
                .schema(rs.getString("schema"))
                .type(rs.getString("type"))
                .ts(rs.getTimestamp("ts").toInstant())
                .ingestTs(ingestTs != null ? ingestTs.toInstant() : null)
                .runId(rs.getString("run_id"))
                .product(rs.getString("product"))
                .version(rs.getString("version"))
                .actorType(rs.getString("actor_type"))
                .actorId(rs.getString("actor_id"))
                .actorName(rs.getString("actor_name"))
                .ctx(rs.getString("ctx"))
                .payload(rs.getString("payload"))
                .build();
    }
}
