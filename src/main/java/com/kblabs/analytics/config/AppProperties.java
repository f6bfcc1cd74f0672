package com.kblabs.analytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/** Typed app.* configuration: Kafka topic, analytics context used for enrichment, query paging limits. */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private KafkaTopicProperties kafka = new KafkaTopicProperties();
    private AnalyticsProperties analytics = new AnalyticsProperties();
    private QueryProperties query = new QueryProperties();

    @Getter
    @Setter
    public static class KafkaTopicProperties {
        private TopicNames topic = new TopicNames();

        @Getter
        @Setter
        public static class TopicNames {
            private String eventsIngestion = "analytics-events";
        }
    }

    @Getter
    @Setter
    public static class AnalyticsProperties {
        private SourceProperties source = new SourceProperties();
        /** Run id stamped on events that carry none; generated at start-up when blank. */
        private String runId;
        private ActorProperties actor = new ActorProperties();
        private Map<String, Object> ctx = new LinkedHashMap<>();

        @Getter
        @Setter
        public static class SourceProperties {
            private String product = "unknown";
            private String version = "0.0.0";
        }

        @Getter
        @Setter
        public static class ActorProperties {
            private String type;
            private String id;
            private String name;
        }
    }

    @Getter
    @Setter
    public static class QueryProperties {
        private int defaultLimit = 100;
        private int maxLimit = 1000;
    }
}
