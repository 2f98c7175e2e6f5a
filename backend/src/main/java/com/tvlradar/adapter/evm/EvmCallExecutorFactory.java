package com.tvlradar.adapter.evm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tvlradar.adapter.RpcEndpointRotator;
import com.tvlradar.adapter.config.EvmRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Creates {@link EvmBatchCallExecutor}s bound to one contract function and block, sharing the transport,
 * endpoint rotator and rate limiter of this instance.
 */
@Component
public class EvmCallExecutorFactory {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final EvmRpcProperties properties;

    public EvmCallExecutorFactory(
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            @Qualifier("evmRpcRateLimiter") RateLimiter rateLimiter,
            ObjectMapper objectMapper,
            EvmRpcProperties properties
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @param block block number, or null for the latest block
     */
    public EvmBatchCallExecutor forFunction(ContractFunction function, Long block) {
        return new EvmBatchCallExecutor(rpcClient, rotator, rateLimiter, objectMapper, function,
                EvmBatchCallExecutor.blockTag(block), properties.getLocalLimiterLogThresholdMs());
    }
}
