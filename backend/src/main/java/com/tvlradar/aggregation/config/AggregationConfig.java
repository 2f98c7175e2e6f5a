package com.tvlradar.aggregation.config;

import com.tvlradar.aggregation.LoggingProgressObserver;
import com.tvlradar.aggregation.ProgressObserver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AggregationProperties.class)
public class AggregationConfig {

    @Bean
    public ProgressObserver progressObserver() {
        return new LoggingProgressObserver();
    }
}
