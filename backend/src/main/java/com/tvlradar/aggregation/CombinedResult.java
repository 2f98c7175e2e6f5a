package com.tvlradar.aggregation;

import com.tvlradar.domain.BalanceMapping;
import com.tvlradar.domain.CallResult;

import java.util.List;

/**
 * One logical result of an aggregated batch. {@code results} is filled in {@link CombineMode#CONCAT} mode,
 * {@code balances} in {@link CombineMode#SUM_BY_KEY} mode.
 */
public record CombinedResult(CombineMode mode, long callCount, List<CallResult> results, BalanceMapping balances) {

    public static CombinedResult concat(long callCount, List<CallResult> results) {
        return new CombinedResult(CombineMode.CONCAT, callCount, List.copyOf(results), null);
    }

    public static CombinedResult balances(long callCount, BalanceMapping balances) {
        return new CombinedResult(CombineMode.SUM_BY_KEY, callCount, List.of(), balances);
    }

    public static CombinedResult empty(CombineMode mode) {
        return mode == CombineMode.SUM_BY_KEY
                ? balances(0, BalanceMapping.noBalancesFound())
                : concat(0, List.of());
    }
}
