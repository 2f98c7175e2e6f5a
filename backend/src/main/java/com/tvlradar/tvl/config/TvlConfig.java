package com.tvlradar.tvl.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(TvlProperties.class)
public class TvlConfig {

    public static final String TOKEN_LIST_CACHE_KEY = "token-list";

    /** Platform addresses of the fetched token list, keyed by {@link #TOKEN_LIST_CACHE_KEY}. */
    @Bean
    public Cache<String, List<String>> supportedTokenListCache(TvlProperties tvlProperties) {
        int ttlHours = Math.max(1, tvlProperties.getTokenListCacheTtlHours());
        return Caffeine.newBuilder()
                .expireAfterWrite(ttlHours, TimeUnit.HOURS)
                .maximumSize(1)
                .build();
    }
}
