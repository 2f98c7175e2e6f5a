package com.tvlradar.domain;

import lombok.Getter;
import lombok.Setter;

/**
 * A discovered pair with the constituent tokens that passed the supported-token filter.
 * Either token field may stay null.
 */
@Getter
@Setter
public class PairRecord {

    private final String pairAddress;
    private String token0Address;
    private String token1Address;

    public PairRecord(String pairAddress) {
        this.pairAddress = pairAddress;
    }

    public boolean hasSupportedToken() {
        return token0Address != null || token1Address != null;
    }
}
