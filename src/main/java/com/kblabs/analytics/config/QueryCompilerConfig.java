package com.kblabs.analytics.config;

import com.kblabs.analytics.domain.query.DefaultMetricsCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Read-only lookup tables handed to the query compiler. */
@Configuration
public class QueryCompilerConfig {

    @Bean
    public DefaultMetricsCatalog defaultMetricsCatalog() {
        return DefaultMetricsCatalog.standard();
    }
}
