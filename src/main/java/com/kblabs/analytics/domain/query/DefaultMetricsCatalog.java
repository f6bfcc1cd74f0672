package com.kblabs.analytics.domain.query;

import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Ordered event-type prefix → metric names table used when a stats query names no metrics.
 *
 * <p>Lookup is first-match in table order, not longest prefix: a filter holding both an {@code llm.}
 * and an {@code embeddings.} type always resolves to the {@code llm.} family.
 */
public final class DefaultMetricsCatalog {

    public static final List<String> GLOBAL_FALLBACK = List.of("totalCost", "totalTokens", "durationMs");

    private static final DefaultMetricsCatalog STANDARD = new DefaultMetricsCatalog(List.of(
            new Entry("llm.", List.of("totalTokens", "totalCost", "durationMs", "inputTokens", "outputTokens")),
            new Entry("embeddings.", List.of("totalTokens", "totalCost", "durationMs")),
            new Entry("vectorstore.", List.of("durationMs")),
            new Entry("cache.", List.of("durationMs")),
            new Entry("storage.", List.of("bytesRead", "bytesWritten", "durationMs"))
    ), GLOBAL_FALLBACK);

    private final List<Entry> entries;
    private final List<String> fallback;

    public DefaultMetricsCatalog(List<Entry> entries, List<String> fallback) {
        this.entries = List.copyOf(entries);
        this.fallback = List.copyOf(fallback);
    }

    /** The built-in kb.v1 table. */
    public static DefaultMetricsCatalog standard() {
        return STANDARD;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public List<String> getFallback() {
        return fallback;
    }

    /** Metric names for the type filter; null or empty filter gives the global fallback. */
    public List<String> metricsFor(Collection<String> types) {
        if (types == null || types.isEmpty()) {
            return fallback;
        }
        for (Entry entry : entries) {
            boolean matches = types.stream()
                    .filter(Objects::nonNull)
                    .anyMatch(type -> type.startsWith(entry.getPrefix()));
            if (matches) {
                return entry.getMetrics();
            }
        }
        return fallback;
    }

    @Value
    public static class Entry {
        String prefix;
        List<String> metrics;

        public Entry(String prefix, List<String> metrics) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
            this.metrics = List.copyOf(metrics);
        }
    }
}
