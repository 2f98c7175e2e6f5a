package com.tvlradar.adapter.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * RPC endpoints and local throttling for the chain the TVL is computed on.
 */
@ConfigurationProperties(prefix = "tvlradar.evm-rpc")
@NoArgsConstructor
@Getter
@Setter
public class EvmRpcProperties {

    /** JSON-RPC endpoints, used round-robin. Must support JSON-RPC batches and historical state. */
    private List<String> urls = new ArrayList<>();

    /** Global request budget (HTTP requests per second, a batch counts once). */
    private int maxRequestsPerSecond = 10;

    /** How long a request may wait for a local permit before failing. */
    private long localLimiterTimeoutMs = 30_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 500;

    public void setUrls(List<String> urls) {
        this.urls = urls != null ? urls : new ArrayList<>();
    }
}
