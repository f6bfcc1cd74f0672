package com.kblabs.analytics.infrastructure.kafka;

import com.kblabs.analytics.api.dto.EventRequest;
import com.kblabs.analytics.config.AppProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/** Publishes enriched events to the ingestion topic keyed by event id; Retry + Circuit Breaker. */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventKafkaProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;

    /** Sends one event and waits for the broker ack. */
    @Retry(name = "kafkaProducer")
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleCircuitBreakerOpen")
    public void send(EventRequest event) throws Exception {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getEventsIngestion());
        String key = Objects.requireNonNull(event.getId(), "id");
        kafkaTemplate.send(topic, key, event).get(1, TimeUnit.SECONDS);
    }

    /** Sends all events in parallel and waits for every ack. */
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleBatchCircuitBreakerOpen")
    public void sendBatch(List<EventRequest> events) throws Exception {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getEventsIngestion());

        List<CompletableFuture<SendResult<String, Object>>> futures = events.stream()
                .map(event -> kafkaTemplate.send(topic, Objects.requireNonNull(event.getId(), "id"), event))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(10, TimeUnit.SECONDS);
    }

    @SuppressWarnings("unused")
    private void handleCircuitBreakerOpen(EventRequest event, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting event id={}, type={}",
                event.getId(), event.getType());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. Kafka circuit breaker is open.", 30);
    }

    /** Fallback once every retry has failed. */
    @SuppressWarnings("unused")
    private void handleCircuitBreakerOpen(EventRequest event, Exception ex) {
        log.error("Kafka produce failed after all retries for event id={}: {}", event.getId(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. " + ex.getMessage(), 30);
    }

    @SuppressWarnings("unused")
    private void handleBatchCircuitBreakerOpen(List<EventRequest> events, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting batch of {} events", events.size());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. Kafka circuit breaker is open.", 30);
    }

    @SuppressWarnings("unused")
    private void handleBatchCircuitBreakerOpen(List<EventRequest> events, Exception ex) {
        log.error("Kafka batch produce failed for {} events: {}", events.size(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. " + ex.getMessage(), 30);
    }

    /** Kafka unreachable or circuit open; GlobalExceptionHandler answers 503 + Retry-After. */
    public static class ServiceUnavailableException extends RuntimeException {
        private final int retryAfterSeconds;

        public ServiceUnavailableException(String message, int retryAfterSeconds) {
            super(message);
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public int getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }
}
