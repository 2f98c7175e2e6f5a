package com.tvlradar.tvl;

import com.tvlradar.domain.BalanceMapping;

/**
 * Result of one TVL run. {@code callCount} counts every on-chain call the run executed, including the
 * single allPairsLength() read.
 */
public record TvlReport(Long block, Long timestamp, int pairCount, int retainedPairs, long callCount,
                        BalanceMapping balances) {
}
