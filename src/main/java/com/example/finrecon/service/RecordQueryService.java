package com.example.finrecon.service;

import com.example.finrecon.config.CacheConfig;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.EconomicIndicator;
import com.example.finrecon.model.doc.ProviderStats;
import com.example.finrecon.repo.EarningsReportRepository;
import com.example.finrecon.repo.EconomicIndicatorRepository;
import com.example.finrecon.service.cache.RedisCacheService;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * 저장된 병합 레코드 조회. Caffeine(L1) → Redis(L2) → Mongo 순.
 */
@Service
@RequiredArgsConstructor
public class RecordQueryService {

    private static final Duration L2_TTL = Duration.ofMinutes(5);

    private final EconomicIndicatorRepository indicatorRepository;
    private final EarningsReportRepository earningsRepository;
    private final ProviderStatsRecorder statsRecorder;
    private final RedisCacheService level2Cache;

    /** code 가 없으면 국가의 전체 지표 */
    @Cacheable(cacheNames = CacheConfig.INDICATORS, key = "#code + ':' + #country")
    public Mono<List<EconomicIndicator>> indicators(String code, String country) {
        String key = "indicators:" + (code == null ? "*" : code) + ":" + country;
        return level2Cache.getOrLoad(key, new TypeReference<List<EconomicIndicator>>() {}, L2_TTL,
                () -> (code == null
                        ? indicatorRepository.findByCountryOrderByPeriodDateDesc(country)
                        : indicatorRepository.findByIndicatorCodeAndCountryOrderByPeriodDateDesc(code, country))
                        .collectList());
    }

    @Cacheable(cacheNames = CacheConfig.EARNINGS, key = "#symbol")
    public Mono<List<EarningsReport>> earnings(String symbol) {
        return level2Cache.getOrLoad("earnings:" + symbol, new TypeReference<List<EarningsReport>>() {}, L2_TTL,
                () -> earningsRepository.findBySymbolOrderByReportedDateDesc(symbol).collectList());
    }

    @Cacheable(cacheNames = CacheConfig.PROVIDER_STATS)
    public Mono<List<ProviderStats>> providerStats() {
        return statsRecorder.all().collectList();
    }
}
