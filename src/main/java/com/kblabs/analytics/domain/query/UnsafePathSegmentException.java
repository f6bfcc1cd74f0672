package com.kblabs.analytics.domain.query;

import lombok.Getter;

/** A field path or metric name segment that could break out of the generated JSON path or SQL literal. */
@Getter
public class UnsafePathSegmentException extends QueryCompilationException {

    private final String path;
    private final String segment;

    public UnsafePathSegmentException(String path, String segment) {
        super(segment.isEmpty()
                ? "Empty segment in field path '" + path + "'"
                : "Unsafe segment '" + segment + "' in field path '" + path + "'");
        this.path = path;
        this.segment = segment;
    }
}
