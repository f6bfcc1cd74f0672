package com.kblabs.analytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI kbAnalyticsOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("KB Labs - Analytics API")
                        .description("""
                                Ingests kb.v1 analytics events through Kafka into PostgreSQL and serves \
                                event listings, summary stats and SQL-native time-series aggregation \
                                (hour/day/week/month buckets, dot-path breakdowns, payload metrics).\
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
