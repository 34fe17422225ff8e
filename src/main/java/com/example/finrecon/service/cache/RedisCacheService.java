package com.example.finrecon.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.function.Supplier;

/**
 * Redis L2 캐시(JSON 문자열). Redis 장애는 캐시 미스로 취급한다.
 */
@Service
public class RedisCacheService {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheService.class);
    static final String PREFIX = "finrecon:";

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper mapper;

    public RedisCacheService(ReactiveStringRedisTemplate redis, ObjectMapper mapper) {
        this.redis = redis;
        this.mapper = mapper;
    }

    public <T> Mono<T> get(String key, TypeReference<T> type) {
        return redis.opsForValue().get(PREFIX + key)
                .flatMap(json -> Mono.fromCallable(() -> mapper.readValue(json, type)))
                .onErrorResume(e -> {
                    log.debug("L2 cache read failed for {}: {}", key, e.toString());
                    return Mono.empty();
                });
    }

    public Mono<Boolean> set(String key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> mapper.writeValueAsString(value))
                .flatMap(js -> redis.opsForValue().set(PREFIX + key, js, ttl))
                .onErrorResume(e -> {
                    log.debug("L2 cache write failed for {}: {}", key, e.toString());
                    return Mono.just(false);
                });
    }

    /** Cached value, or the loader's result written back with {@code ttl}. Empty collections are not written. */
    public <T> Mono<T> getOrLoad(String key, TypeReference<T> type, Duration ttl, Supplier<Mono<T>> loader) {
        return get(key, type)
                .switchIfEmpty(Mono.defer(loader)
                        .flatMap(v -> isEmptyCollection(v) ? Mono.just(v) : set(key, v, ttl).thenReturn(v)));
    }

    /** 패턴(Redis glob, prefix 제외)에 맞는 키를 SCAN 으로 찾아 삭제. 삭제한 키 수를 돌려준다. */
    public Mono<Long> evict(String pattern) {
        ScanOptions options = ScanOptions.scanOptions().match(PREFIX + pattern).count(500).build();
        return redis.delete(redis.scan(options))
                .onErrorResume(e -> {
                    log.debug("L2 cache evict failed for {}: {}", pattern, e.toString());
                    return Mono.just(0L);
                });
    }

    private static boolean isEmptyCollection(Object v) {
        return v instanceof Collection<?> c && c.isEmpty();
    }
}
