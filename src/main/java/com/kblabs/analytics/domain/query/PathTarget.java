package com.kblabs.analytics.domain.query;

/** Closed set of places a dot-path can resolve to, in resolution priority order. */
public enum PathTarget {
    /** Flattened scalar column or alias: product, version, type, run_id/runId. */
    DIRECT_COLUMN,
    /** actor.type / actor.id / actor.name. */
    ACTOR_FIELD,
    /** source.product / source.version. */
    SOURCE_FIELD,
    /** Explicit payload.* or ctx.* path. */
    JSON_COLUMN,
    /** Unrecognized root, read from payload using the whole path. */
    FALLBACK
}
