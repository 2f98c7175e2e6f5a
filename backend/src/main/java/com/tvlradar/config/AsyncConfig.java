package com.tvlradar.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: aggregation-executor runs chunk round-trips; discovery-executor runs coordinator tasks
 * (the parallel token0/token1 multicalls) so they do not hold a slot in the worker pool they wait on.
 */
@Configuration
public class AsyncConfig {

    public static final String AGGREGATION_EXECUTOR = "aggregation-executor";
    public static final String DISCOVERY_EXECUTOR = "discovery-executor";

    @Bean(name = AGGREGATION_EXECUTOR)
    public Executor aggregationExecutor(@Value("${tvlradar.async.aggregation-pool-size:8}") int poolSize) {
        int size = Math.max(1, poolSize);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("aggregation-");
        e.initialize();
        return e;
    }

    /** Two threads: one per token side of a pair. */
    @Bean(name = DISCOVERY_EXECUTOR)
    public Executor discoveryExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("discovery-");
        e.initialize();
        return e;
    }
}
