package com.tvlradar.tvl.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Which exchange is measured and where the supported-token list comes from.
 */
@ConfigurationProperties(prefix = "tvlradar.tvl")
@NoArgsConstructor
@Getter
@Setter
public class TvlProperties {

    /** Pair factory contract (Dfyn on Polygon by default). */
    private String factoryAddress = "0xe7fb3e833efe5f9c441105eb65ef8b261266423b";

    /** Platform key of the coin list whose addresses form the supported-token set. */
    private String platformId = "polygon-pos";

    /** Coin list with platform addresses, CoinGecko format. */
    private String tokenListUrl = "https://api.coingecko.com/api/v3/coins/list?include_platform=true";

    /** TTL in hours for the cached token list. */
    private int tokenListCacheTtlHours = 24;

    /** Token addresses counted as supported in addition to the fetched list. */
    private List<String> extraSupportedTokens = new ArrayList<>();

    public void setExtraSupportedTokens(List<String> extraSupportedTokens) {
        this.extraSupportedTokens = extraSupportedTokens != null ? extraSupportedTokens : new ArrayList<>();
    }
}
