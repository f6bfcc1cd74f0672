package com.kblabs.analytics.infrastructure.kafka;

import com.kblabs.analytics.api.dto.EventRequest;
import com.kblabs.analytics.domain.mapper.EventMapper;
import com.kblabs.analytics.domain.service.EventIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Consumes the ingestion topic in batches and persists through EventIngestionService; bad records go to the DLT. */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventKafkaConsumer {

    /** Set by ErrorHandlingDeserializer when the value could not be read; the value is then null. */
    private static final String VALUE_DESERIALIZATION_EXCEPTION_HEADER =
            "springDeserializationValueException";

    private final EventIngestionService eventIngestionService;
    private final EventMapper eventMapper;
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${app.kafka.topic.events-ingestion}")
    private String eventsIngestionTopic;

    /** Converts the batch, persists valid events in one transaction, then acknowledges. */
    @KafkaListener(
            topics = "${app.kafka.topic.events-ingestion}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, Object>> records, Acknowledgment acknowledgment) {
        log.debug("Received batch of {} records from {}", records.size(), eventsIngestionTopic);

        List<EventRequest> events = new ArrayList<>(records.size());
        int dltCount = 0;

        for (ConsumerRecord<String, Object> record : records) {
            if (hasDeserializationError(record)) {
                log.error("Kafka deserialization failed for record at offset={}, partition={}",
                        record.offset(), record.partition());
                publishToDlt(record, "Kafka-level deserialization failure");
                dltCount++;
                continue;
            }

            try {
                EventRequest event = eventMapper.fromRecordValue(record.value());
                if (isStorable(event)) {
                    events.add(event);
                } else {
                    publishToDlt(record, "Missing id, type or ts");
                    dltCount++;
                }
            } catch (IllegalArgumentException e) {
                log.error("Failed to convert record at offset={}, partition={}: {}",
                        record.offset(), record.partition(), e.getMessage());
                publishToDlt(record, e.getMessage());
                dltCount++;
            }
        }

        if (!events.isEmpty()) {
            int inserted = eventIngestionService.processBatch(events);
            log.info("Batch processed: {} records received, {} events converted, {} new events inserted, {} sent to DLT",
                    records.size(), events.size(), inserted, dltCount);
        } else if (dltCount > 0) {
            log.warn("All {} records in batch failed conversion, {} sent to DLT", records.size(), dltCount);
        }

        acknowledgment.acknowledge();
    }

    /** The producer enriches before publishing, so these are only missing on foreign messages. */
    private boolean isStorable(EventRequest event) {
        return event != null && event.getId() != null && event.getType() != null && event.getTs() != null;
    }

    private boolean hasDeserializationError(ConsumerRecord<String, Object> record) {
        Headers headers = record.headers();
        return headers.lastHeader(VALUE_DESERIALIZATION_EXCEPTION_HEADER) != null;
    }

    /** Forwards a failed record to the DLT; a DLT failure is logged and the batch continues. */
    private void publishToDlt(ConsumerRecord<String, Object> record, String reason) {
        String topic = Objects.requireNonNull(eventsIngestionTopic, "eventsIngestionTopic") + ".DLT";
        try {
            String key = Objects.requireNonNullElse(record.key(), "");
            kafkaTemplate.send(topic, key, record.value());
            log.warn("Sent failed record to DLT: topic={}, offset={}, partition={}, reason={}",
                    topic, record.offset(), record.partition(), Objects.requireNonNullElse(reason, ""));
        } catch (Exception dltEx) {
            log.error("Failed to publish record to DLT {}: {}", topic, dltEx.getMessage(), dltEx);
        }
    }
}
