package com.kblabs.analytics.domain.query;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds text-extraction expressions over the JSONB document columns.
 *
 * <p>Segments are caller-controlled and end up inside a single-quoted SQL literal holding a
 * jsonpath, so they are validated before concatenation: quotes, backslashes and control
 * characters are rejected, identifier-like segments are emitted bare ({@code $.model}) and the
 * rest as quoted jsonpath members ({@code $."session-id"}).
 */
public final class JsonPathExpressions {

    private static final Pattern BARE_SEGMENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern FORBIDDEN = Pattern.compile("['\"\\\\\\p{Cntrl}]");

    private JsonPathExpressions() {
    }

    /**
     * {@code jsonb_path_query_first(<column>, '$.a.b') #>> '{}'}: the value at the path as text,
     * NULL when absent. An empty segment list addresses the whole document.
     *
     * @param path the original dot-path, used for error reporting only
     */
    public static String extractText(String column, List<String> segments, String path) {
        return "jsonb_path_query_first(" + column + ", '" + jsonPath(segments, path) + "') #>> '{}'";
    }

    /** Validated jsonpath for the given segments. */
    public static String jsonPath(List<String> segments, String path) {
        StringBuilder jsonPath = new StringBuilder("$");
        for (String segment : segments) {
            requireSafe(segment, path);
            jsonPath.append('.');
            if (BARE_SEGMENT.matcher(segment).matches()) {
                jsonPath.append(segment);
            } else {
                jsonPath.append('"').append(segment).append('"');
            }
        }
        return jsonPath.toString();
    }

    /** Throws {@link UnsafePathSegmentException} for empty segments or ones carrying a delimiter. */
    public static void requireSafe(String segment, String path) {
        if (segment.isEmpty() || FORBIDDEN.matcher(segment).find()) {
            throw new UnsafePathSegmentException(path, segment);
        }
    }
}
