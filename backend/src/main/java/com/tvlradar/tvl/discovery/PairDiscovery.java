package com.tvlradar.tvl.discovery;

import com.tvlradar.domain.PairRecord;

import java.util.List;

/**
 * Outcome of enumerating a factory: how many pairs it reports, the pairs holding at least one supported token,
 * and the on-chain calls spent finding them.
 */
public record PairDiscovery(int pairCount, List<PairRecord> pairs, long callCount) {

    public PairDiscovery {
        pairs = List.copyOf(pairs);
    }
}
