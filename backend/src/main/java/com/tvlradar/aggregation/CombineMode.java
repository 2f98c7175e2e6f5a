package com.tvlradar.aggregation;

/**
 * How per-chunk outputs are merged into one result.
 */
public enum CombineMode {
    /** Ordered concatenation of every chunk's call results. */
    CONCAT,
    /** Additive merge of balances keyed by the call target. */
    SUM_BY_KEY
}
