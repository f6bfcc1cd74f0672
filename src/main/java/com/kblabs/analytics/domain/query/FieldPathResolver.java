package com.kblabs.analytics.domain.query;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a dot-path ({@code payload.model}, {@code actor.id}, {@code runId}) to the SQL expression that
 * reads it from an events row.
 *
 * <p>Priority: direct column/alias, actor sub-field, source sub-field, explicit {@code payload}/{@code ctx}
 * path, then the whole path as a payload field. Stateless and safe to share between threads.
 */
@Component
public class FieldPathResolver {

    private static final Map<String, String> DIRECT_COLUMNS = Map.of(
            "product", "product",
            "version", "version",
            "type", "type",
            "run_id", "run_id",
            "runId", "run_id"
    );

    private static final Map<String, String> ACTOR_COLUMNS = Map.of(
            "type", "actor_type",
            "id", "actor_id",
            "name", "actor_name"
    );

    private static final Map<String, String> SOURCE_COLUMNS = Map.of(
            "product", "product",
            "version", "version"
    );

    private static final String ACTOR_ROOT = "actor";
    private static final String SOURCE_ROOT = "source";
    private static final String PAYLOAD_COLUMN = "payload";
    private static final String CTX_COLUMN = "ctx";

    /** SQL expression for the path; see {@link #resolve(String)}. */
    public String resolvePath(String path) {
        return resolve(path).toSql();
    }

    public ResolvedPath resolve(String path) {
        Objects.requireNonNull(path, "path");
        List<String> segments = Arrays.asList(path.split("\\.", -1));
        String root = segments.get(0);
        String child = segments.size() > 1 ? segments.get(1) : null;

        String direct = DIRECT_COLUMNS.get(root);
        if (direct != null) {
            return ResolvedPath.column(path, PathTarget.DIRECT_COLUMN, direct);
        }

        if (ACTOR_ROOT.equals(root) && child != null && ACTOR_COLUMNS.containsKey(child)) {
            return ResolvedPath.column(path, PathTarget.ACTOR_FIELD, ACTOR_COLUMNS.get(child));
        }

        if (SOURCE_ROOT.equals(root) && child != null && SOURCE_COLUMNS.containsKey(child)) {
            return ResolvedPath.column(path, PathTarget.SOURCE_FIELD, SOURCE_COLUMNS.get(child));
        }

        if (PAYLOAD_COLUMN.equals(root) || CTX_COLUMN.equals(root)) {
            return ResolvedPath.json(path, PathTarget.JSON_COLUMN, root, segments.subList(1, segments.size()));
        }

        // Unknown roots are read as payload fields; a misspelled "ctx" root lands here too.
        return ResolvedPath.json(path, PathTarget.FALLBACK, PAYLOAD_COLUMN, segments);
    }
}
