package com.kblabs.analytics.config;

import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/** Listener error handling: exponential backoff, then the batch goes to the DLT. */
@Configuration
public class KafkaConsumerConfig {

    @Value("${app.kafka.topic.events-ingestion}")
    private String eventsIngestionTopic;

    @Bean
    public CommonErrorHandler kafkaErrorHandler(KafkaOperations<?, ?> kafkaOperations) {
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaOperations,
                (record, ex) -> new TopicPartition(eventsIngestionTopic + ".DLT", 0)
        );

        // ~7s of retries (1s, 2s, 4s) before giving up on a poisoned batch
        ExponentialBackOff backOff = new ExponentialBackOff(1000L, 2.0);
        backOff.setMaxInterval(4000L);
        backOff.setMaxElapsedTime(7000L);

        return new DefaultErrorHandler(recoverer, backOff);
    }
}
