package com.tvlradar.aggregation;

import com.tvlradar.domain.BalanceMapping;
import com.tvlradar.domain.CallResult;
import com.tvlradar.domain.ChunkResult;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges per-chunk outputs. Pure: inputs are not modified and the result depends only on them.
 */
public final class ResultCombiner {

    private ResultCombiner() {}

    public static CombinedResult combine(List<ChunkResult> chunkResults, CombineMode mode) {
        return switch (mode) {
            case CONCAT -> concat(chunkResults);
            case SUM_BY_KEY -> sumByKey(chunkResults);
        };
    }

    static CombinedResult concat(List<ChunkResult> chunkResults) {
        long callCount = 0;
        List<CallResult> all = new ArrayList<>();
        for (ChunkResult chunkResult : chunkResults) {
            callCount += chunkResult.callCount();
            all.addAll(chunkResult.results());
        }
        return CombinedResult.concat(callCount, all);
    }

    /**
     * Each chunk is folded into its own partial mapping first, then partials are merged. Zero balances add no key,
     * so a total with no positive balance becomes the {@link BalanceMapping#noBalancesFound()} sentinel.
     */
    static CombinedResult sumByKey(List<ChunkResult> chunkResults) {
        long callCount = 0;
        BalanceMapping total = new BalanceMapping();
        for (ChunkResult chunkResult : chunkResults) {
            callCount += chunkResult.callCount();
            total.merge(partialBalances(chunkResult));
        }
        if (total.isEmpty()) {
            return CombinedResult.balances(callCount, BalanceMapping.noBalancesFound());
        }
        return CombinedResult.balances(callCount, total);
    }

    static BalanceMapping partialBalances(ChunkResult chunkResult) {
        BalanceMapping partial = new BalanceMapping();
        for (CallResult result : chunkResult.results()) {
            if (!result.success() || result.output() == null) {
                continue;
            }
            BigInteger amount = toBigInteger(result.output());
            if (amount.signum() <= 0) {
                continue;
            }
            partial.add(result.call().target(), amount);
        }
        return partial;
    }

    private static BigInteger toBigInteger(Object output) {
        if (output instanceof BigInteger value) {
            return value;
        }
        if (output instanceof Number number) {
            return BigInteger.valueOf(number.longValue());
        }
        return new BigInteger(output.toString());
    }
}
