package com.kblabs.analytics.domain.query;

import lombok.Value;

import java.util.List;

/** Outcome of resolving one dot-path: the target kind, the physical column and, for JSON targets, the inner segments. */
@Value
public class ResolvedPath {

    String path;
    PathTarget target;
    String column;
    List<String> jsonSegments;

    static ResolvedPath column(String path, PathTarget target, String column) {
        return new ResolvedPath(path, target, column, List.of());
    }

    static ResolvedPath json(String path, PathTarget target, String column, List<String> segments) {
        segments.forEach(segment -> JsonPathExpressions.requireSafe(segment, path));
        return new ResolvedPath(path, target, column, List.copyOf(segments));
    }

    public boolean isJson() {
        return target == PathTarget.JSON_COLUMN || target == PathTarget.FALLBACK;
    }

    /** SQL expression reading this field from an events row. */
    public String toSql() {
        return switch (target) {
            case DIRECT_COLUMN, ACTOR_FIELD, SOURCE_FIELD -> column;
            case JSON_COLUMN, FALLBACK -> JsonPathExpressions.extractText(column, jsonSegments, path);
        };
    }
}
