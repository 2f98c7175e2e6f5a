package com.tvlradar.aggregation;

import com.tvlradar.domain.Chunk;
import com.tvlradar.domain.ChunkResult;

/**
 * Performs one network round-trip for a whole chunk. Implementations must return one result per call,
 * in chunk order, or throw; the aggregation layer does not catch or reinterpret the exception.
 */
@FunctionalInterface
public interface RemoteCallExecutor {

    ChunkResult execute(Chunk chunk);
}
