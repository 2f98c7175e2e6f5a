package com.tvlradar.aggregation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chunking and concurrency settings for batched on-chain reads.
 */
@ConfigurationProperties(prefix = "tvlradar.aggregation")
@NoArgsConstructor
@Getter
@Setter
public class AggregationProperties {

    /** Chunks in flight at once per dispatch. 1 runs chunks strictly one after another. */
    private int concurrency = 1;

    /** Calls per round-trip for generic multi-reads (pair enumeration, token0/token1). */
    private int multicallChunkSize = 5_000;

    /** Calls per round-trip for balanceOf batches. */
    private int balanceChunkSize = 2_500;
}
