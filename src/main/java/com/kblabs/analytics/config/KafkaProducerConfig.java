package com.kblabs.analytics.config;

import org.apache.kafka.clients.admin.NewTopic;

import java.util.Objects;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/** Ingestion and DLT topic beans. */
@Configuration
public class KafkaProducerConfig {

    @Value("${app.kafka.topic.events-ingestion}")
    private String eventsIngestionTopic;

    /** Keyed by event id; 3 partitions match the listener concurrency in application.yaml. */
    @Bean
    public NewTopic eventsIngestionTopic() {
        return TopicBuilder.name(Objects.requireNonNull(eventsIngestionTopic, "eventsIngestionTopic"))
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic eventsIngestionDlt() {
        return TopicBuilder.name(Objects.requireNonNull(eventsIngestionTopic, "eventsIngestionTopic") + ".DLT")
                .partitions(1)
                .replicas(1)
                .build();
    }
}
