package com.tvlradar.api.dto;

import com.tvlradar.tvl.TvlReport;

import java.util.Map;

/**
 * GET /tvl response. {@code block} is null when the latest block was read. Balances are raw integer amounts
 * per token address; with nothing found the map is {@code {"0x000...000": 0}}.
 */
public record TvlResponse(Long block, Long timestamp, long callCount, Map<String, Number> balances) {

    public static TvlResponse from(TvlReport report) {
        return new TvlResponse(report.block(), report.timestamp(), report.callCount(), report.balances().asMap());
    }
}
