package com.example.clubadmin.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String LEDGER_ACCOUNTS = "ledgerAccounts";
    public static final String POST_AUTHORS = "postAuthors";

    @Bean
    public CacheManager cacheManager() {
        // Every @Cacheable name must be listed here.
        CaffeineCacheManager cm = new CaffeineCacheManager(LEDGER_ACCOUNTS, POST_AUTHORS);
        cm.setCaffeine(Caffeine.newBuilder()
                .recordStats()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(500));
        return cm;
    }
}
