package com.vaultledger.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches: partner lookup by API key hash (evicted on key regeneration and status change),
 * collateral asset by token address (evicted on registry events and price updates).
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String PARTNER_BY_KEY_HASH_CACHE = "partner-by-key-hash";
    public static final String ASSET_BY_TOKEN_CACHE = "asset-by-token";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(PARTNER_BY_KEY_HASH_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(ASSET_BY_TOKEN_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(30, TimeUnit.MINUTES)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
