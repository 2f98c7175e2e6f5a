package com.tvlradar.aggregation;

import com.tvlradar.aggregation.config.AggregationProperties;
import com.tvlradar.domain.CallDescriptor;
import com.tvlradar.domain.Chunk;
import com.tvlradar.domain.ChunkResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point of the aggregation engine: plan chunks, dispatch them under the configured concurrency limit,
 * combine the chunk outputs and check that every submitted call was executed exactly once.
 * Keeps a cumulative count of executed on-chain calls across operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchCallAggregator {

    private final ChunkDispatcher chunkDispatcher;
    private final AggregationProperties aggregationProperties;
    private final AtomicLong callCount = new AtomicLong();

    /**
     * Generic multi-read: results in call order, chunked by {@code multicall-chunk-size}.
     */
    public CombinedResult multiCall(String operation, List<CallDescriptor> calls, RemoteCallExecutor executor) {
        return aggregate(operation, calls, aggregationProperties.getMulticallChunkSize(), CombineMode.CONCAT, executor);
    }

    /**
     * Balance read: balances summed per call target, chunked by {@code balance-chunk-size}.
     */
    public CombinedResult sumBalances(String operation, List<CallDescriptor> calls, RemoteCallExecutor executor) {
        return aggregate(operation, calls, aggregationProperties.getBalanceChunkSize(), CombineMode.SUM_BY_KEY, executor);
    }

    public CombinedResult aggregate(String operation, List<CallDescriptor> calls, int maxChunkSize,
                                    CombineMode mode, RemoteCallExecutor executor) {
        List<Chunk> chunks = ChunkPlanner.plan(calls, maxChunkSize);
        if (chunks.isEmpty()) {
            return CombinedResult.empty(mode);
        }
        int concurrency = Math.max(1, aggregationProperties.getConcurrency());
        log.debug("{}: {} calls in {} chunks (max {} per chunk, concurrency {})",
                operation, calls.size(), chunks.size(), maxChunkSize, concurrency);

        List<ChunkResult> chunkResults = chunkDispatcher.dispatch(operation, chunks, concurrency, executor);
        CombinedResult combined = ResultCombiner.combine(chunkResults, mode);
        if (combined.callCount() != calls.size()) {
            throw new BookkeepingViolationException(operation + ": executed " + combined.callCount()
                    + " calls but " + calls.size() + " were submitted");
        }
        callCount.addAndGet(combined.callCount());
        return combined;
    }

    /** Total on-chain calls executed through this aggregator since start or the last reset. */
    public long getCallCount() {
        return callCount.get();
    }

    public void resetCallCount() {
        callCount.set(0);
    }
}
