package com.example.finrecon.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@EnableCaching
@Configuration
public class CacheConfig {

    public static final String INDICATORS = "indicators";
    public static final String EARNINGS = "earnings";
    public static final String PROVIDER_STATS = "providerStats";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cm = new CaffeineCacheManager(INDICATORS, EARNINGS, PROVIDER_STATS);
        cm.setCaffeine(Caffeine.newBuilder()
                .maximumSize(2_000)
                .expireAfterWrite(Duration.ofSeconds(30)));
        // Reactive @Cacheable(Mono/Flux) 사용 시 AsyncCache 필요
        cm.setAsyncCacheMode(true);
        return cm;
    }
}
