package com.tvlradar.domain;

import java.util.List;

/**
 * Output of one remote round-trip: how many on-chain calls were executed and their results, in chunk order.
 */
public record ChunkResult(int callCount, List<CallResult> results) {

    public ChunkResult {
        if (callCount < 0) {
            throw new IllegalArgumentException("callCount must be >= 0");
        }
        results = results == null ? List.of() : List.copyOf(results);
    }
}
