package com.kblabs.analytics.domain.query;

/** Base type for errors raised while turning an analytics query into SQL text; GlobalExceptionHandler maps it to 400. */
public class QueryCompilationException extends RuntimeException {

    public QueryCompilationException(String message) {
        super(message);
    }
}
