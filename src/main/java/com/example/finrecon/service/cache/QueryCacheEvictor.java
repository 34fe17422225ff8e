package com.example.finrecon.service.cache;

import com.example.finrecon.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 병합 결과가 저장된 뒤 조회 캐시(Caffeine L1, Redis L2)를 비운다.
 * 다음 GET 은 Mongo 에서 새로 읽는다.
 */
@Component
public class QueryCacheEvictor {

    private static final Logger log = LoggerFactory.getLogger(QueryCacheEvictor.class);

    private final CacheManager cacheManager;
    private final RedisCacheService level2Cache;

    public QueryCacheEvictor(CacheManager cacheManager, RedisCacheService level2Cache) {
        this.cacheManager = cacheManager;
        this.level2Cache = level2Cache;
    }

    /** L1 지표 캐시는 code:country 키라 전체를 비우고, L2 는 해당 국가 키만 지운다. */
    public Mono<Void> indicatorsStored(String country) {
        return Mono.fromRunnable(() -> {
                    clear(CacheConfig.INDICATORS);
                    clear(CacheConfig.PROVIDER_STATS);
                })
                .then(level2Cache.evict("indicators:*:" + country))
                .doOnNext(n -> log.debug("Evicted {} L2 indicator key(s) for {}", n, country))
                .then();
    }

    public Mono<Void> earningsStored(String symbol) {
        return Mono.fromRunnable(() -> {
                    Cache earnings = cacheManager.getCache(CacheConfig.EARNINGS);
                    if (earnings != null) earnings.evict(symbol);
                    clear(CacheConfig.PROVIDER_STATS);
                })
                .then(level2Cache.evict("earnings:" + symbol))
                .doOnNext(n -> log.debug("Evicted {} L2 earnings key(s) for {}", n, symbol))
                .then();
    }

    private void clear(String name) {
        Cache cache = cacheManager.getCache(name);
        if (cache != null) cache.clear();
    }
}
