package com.tvlradar.tvl.token;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tvlradar.tvl.config.TvlConfig;
import com.tvlradar.tvl.config.TvlProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoinListSupportedTokenSourceTest {

    private static final String COINS_LIST_JSON = """
            [
              {"id":"usd-coin","symbol":"usdc","name":"USD Coin","platforms":{"ethereum":"0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48","polygon-pos":"0x2791BCA1F2DE4661ED88A30C99A7A9449AA84174"}},
              {"id":"weth","symbol":"weth","name":"WETH","platforms":{"polygon-pos":"0x7ceb23fd6bc0add59e62ac25578270cff1b9f619"}},
              {"id":"bitcoin","symbol":"btc","name":"Bitcoin","platforms":{}},
              {"id":"blank","symbol":"x","name":"Blank","platforms":{"polygon-pos":""}}
            ]""";

    private Cache<String, List<String>> cache;
    private TvlProperties props;

    @BeforeEach
    void setUp() {
        cache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofHours(1))
                .maximumSize(1)
                .build();
        props = new TvlProperties();
    }

    @Test
    @DisplayName("parsePlatformAddresses keeps lower-cased addresses of the platform only")
    void parsePlatformAddresses() {
        List<String> addresses = CoinListSupportedTokenSource.parsePlatformAddresses(COINS_LIST_JSON, "polygon-pos");

        assertThat(addresses).containsExactly(
                "0x2791bca1f2de4661ed88a30c99a7a9449aa84174",
                "0x7ceb23fd6bc0add59e62ac25578270cff1b9f619");
    }

    @Test
    @DisplayName("non-array body is rejected")
    void rejectsNonArray() {
        assertThatThrownBy(() -> CoinListSupportedTokenSource.parsePlatformAddresses("{\"status\":\"rate limited\"}",
                "polygon-pos"))
                .isInstanceOf(TokenListUnavailableException.class);
    }

    @Test
    @DisplayName("supportedTokens uses the cached list and adds extra tokens")
    void usesCacheAndExtras() {
        cache.put(TvlConfig.TOKEN_LIST_CACHE_KEY,
                CoinListSupportedTokenSource.parsePlatformAddresses(COINS_LIST_JSON, "polygon-pos"));
        props.setExtraSupportedTokens(List.of("0xD6DF932A45C0F255F85145F286EA0B292B21C90B", "  "));
        CoinListSupportedTokenSource source = new CoinListSupportedTokenSource(props, WebClient.builder(), cache);

        assertThat(source.supportedTokens()).containsExactly(
                "0x2791bca1f2de4661ed88a30c99a7a9449aa84174",
                "0x7ceb23fd6bc0add59e62ac25578270cff1b9f619",
                "0xd6df932a45c0f255f85145f286ea0b292b21c90b");
    }
}
