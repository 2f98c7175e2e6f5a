package com.tvlradar.adapter.config;

import com.tvlradar.adapter.RpcEndpointRotator;
import com.tvlradar.adapter.evm.EvmRpcClient;
import com.tvlradar.adapter.evm.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Wires the EVM JSON-RPC transport: endpoint rotator, WebClient-based client and the shared request limiter.
 */
@Configuration
@EnableConfigurationProperties(EvmRpcProperties.class)
public class EvmAdapterConfig {

    /** Used when no endpoint is configured, so the context still starts. */
    private static final List<String> DEFAULT_FALLBACK_URLS = List.of("https://polygon-rpc.com");

    @Bean
    public RpcEndpointRotator evmRpcEndpointRotator(EvmRpcProperties properties) {
        List<String> urls = properties.getUrls().isEmpty() ? DEFAULT_FALLBACK_URLS : properties.getUrls();
        return new RpcEndpointRotator(urls);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(EvmRpcProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }
}
