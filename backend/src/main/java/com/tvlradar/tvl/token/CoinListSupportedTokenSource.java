package com.tvlradar.tvl.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.tvlradar.tvl.config.TvlConfig;
import com.tvlradar.tvl.config.TvlProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Supported tokens from a CoinGecko-style coin list ({@code [{id, platforms: {platformId: address}}]}): every coin
 * with an address on the configured platform, plus the configured extra tokens. The fetched list is cached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinListSupportedTokenSource implements SupportedTokenSource {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TvlProperties tvlProperties;
    private final WebClient.Builder webClientBuilder;
    private final Cache<String, List<String>> supportedTokenListCache;

    @Override
    public List<String> supportedTokens() {
        List<String> fetched = supportedTokenListCache.get(TvlConfig.TOKEN_LIST_CACHE_KEY, k -> fetchPlatformAddresses());
        Set<String> tokens = new LinkedHashSet<>(fetched);
        for (String extra : tvlProperties.getExtraSupportedTokens()) {
            if (extra != null && !extra.isBlank()) {
                tokens.add(extra.strip().toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(tokens);
    }

    private List<String> fetchPlatformAddresses() {
        String url = tvlProperties.getTokenListUrl();
        String response;
        try {
            response = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            throw new TokenListUnavailableException("Token list fetch failed: HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new TokenListUnavailableException("Token list fetch failed: " + e.getMessage(), e);
        }
        List<String> addresses = parsePlatformAddresses(response, tvlProperties.getPlatformId());
        log.info("Loaded {} supported tokens for platform {}", addresses.size(), tvlProperties.getPlatformId());
        return addresses;
    }

    static List<String> parsePlatformAddresses(String json, String platformId) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json == null ? "" : json);
        } catch (Exception e) {
            throw new TokenListUnavailableException("Failed to parse token list", e);
        }
        if (root == null || !root.isArray()) {
            throw new TokenListUnavailableException("Token list is not a JSON array", null);
        }
        List<String> addresses = new ArrayList<>();
        for (JsonNode coin : root) {
            JsonNode address = coin.path("platforms").path(platformId);
            if (!address.isTextual()) {
                continue;
            }
            String value = address.asText().strip();
            if (value.isEmpty()) {
                continue;
            }
            addresses.add(value.toLowerCase(Locale.ROOT));
        }
        return addresses;
    }
}
