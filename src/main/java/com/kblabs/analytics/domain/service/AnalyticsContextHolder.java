package com.kblabs.analytics.domain.service;

import com.kblabs.analytics.config.AppProperties;
import com.kblabs.analytics.domain.model.AnalyticsContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/** Current analytics context, seeded from app.analytics.*; the source can be replaced at runtime. */
@Slf4j
@Component
public class AnalyticsContextHolder {

    private final AtomicReference<AnalyticsContext> current;

    public AnalyticsContextHolder(AppProperties appProperties) {
        this.current = new AtomicReference<>(fromProperties(appProperties.getAnalytics()));
        log.info("Analytics context: product={}, version={}, runId={}",
                current.get().getSource().getProduct(), current.get().getSource().getVersion(),
                current.get().getRunId());
    }

    public AnalyticsContext current() {
        return current.get();
    }

    public AnalyticsContext.Source getSource() {
        return current.get().getSource();
    }

    /** Events enriched after this call are attributed to the new source. */
    public void setSource(String product, String version) {
        AnalyticsContext.Source source = new AnalyticsContext.Source(product, version);
        current.updateAndGet(context -> context.withSource(source));
        log.info("Analytics source set to {}@{}", product, version);
    }

    private static AnalyticsContext fromProperties(AppProperties.AnalyticsProperties properties) {
        AppProperties.AnalyticsProperties.ActorProperties actor = properties.getActor();
        String runId = properties.getRunId() == null || properties.getRunId().isBlank()
                ? "run-" + System.currentTimeMillis()
                : properties.getRunId();
        return AnalyticsContext.builder()
                .source(new AnalyticsContext.Source(
                        properties.getSource().getProduct(), properties.getSource().getVersion()))
                .runId(runId)
                .actor(actor.getType() != null
                        ? new AnalyticsContext.Actor(actor.getType(), actor.getId(), actor.getName())
                        : null)
                .ctx(properties.getCtx().isEmpty() ? null : Map.copyOf(properties.getCtx()))
                .build();
    }
}
