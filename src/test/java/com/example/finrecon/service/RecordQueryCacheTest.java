package com.example.finrecon.service;

import com.example.finrecon.config.CacheConfig;
import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.model.EconomicIndicator;
import com.example.finrecon.model.IngestSummary;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.provider.RequestPacer;
import com.example.finrecon.repo.EarningsReportRepository;
import com.example.finrecon.repo.EconomicIndicatorRepository;
import com.example.finrecon.service.cache.QueryCacheEvictor;
import com.example.finrecon.service.cache.RedisCacheService;
import com.example.finrecon.service.merge.IndicatorSchema;
import com.example.finrecon.service.merge.RecordMerger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.cache.CacheManager;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Caffeine L1 캐시를 실제 프록시로 태워 수집 후 조회 결과가 갱신되는지 확인한다. Redis L2 는 로더를 그대로 호출한다.
 */
@SpringJUnitConfig(classes = {CacheConfig.class, RecordQueryService.class, QueryCacheEvictor.class})
class RecordQueryCacheTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-16T09:00:00Z"), ZoneOffset.UTC);

    @MockBean
    EconomicIndicatorRepository indicatorRepository;
    @MockBean
    EarningsReportRepository earningsRepository;
    @MockBean
    ProviderStatsRecorder stats;
    @MockBean
    RedisCacheService level2Cache;

    @Autowired
    RecordQueryService queryService;
    @Autowired
    QueryCacheEvictor cacheEvictor;
    @Autowired
    CacheManager cacheManager;

    @BeforeEach
    void setUp() {
        cacheManager.getCacheNames().forEach(name -> cacheManager.getCache(name).clear());
        when(level2Cache.getOrLoad(anyString(), any(), any(), any())).thenAnswer(inv -> {
            Supplier<Mono<Object>> loader = inv.getArgument(3);
            return loader.get();
        });
        when(level2Cache.evict(anyString())).thenReturn(Mono.just(1L));
        when(stats.record(anyList())).thenReturn(Mono.empty());
    }

    @Test
    @DisplayName("수집 전에 비어 있던 조회 결과는 저장 성공 후 새 데이터를 돌려준다")
    void indicatorQueryBeforeIngestSeesStoredRecordsAfterIngest() {
        List<EconomicIndicator> collection = new CopyOnWriteArrayList<>();
        when(indicatorRepository.findByIndicatorCodeAndCountryOrderByPeriodDateDesc("CPI", "US"))
                .thenAnswer(inv -> Flux.fromIterable(List.copyOf(collection)));
        RecordSink<EconomicIndicator> sink = records -> {
            collection.addAll(records);
            return Mono.just(true);
        };

        assertEquals(List.of(), queryService.indicators("CPI", "US").block());
        assertEquals(List.of(), queryService.indicators("CPI", "US").block());
        verify(indicatorRepository, times(1)).findByIndicatorCodeAndCountryOrderByPeriodDateDesc("CPI", "US");

        EconomicIndicator cpi = new EconomicIndicator();
        cpi.setIndicatorCode("CPI");
        cpi.setCountry("US");
        cpi.setPeriodDate(LocalDate.of(2024, 5, 1));
        cpi.setValue(313.5);
        cpi.addProvider("fred");
        FetchOrchestrator orchestrator = new FetchOrchestrator(Duration.ofSeconds(5), 5, RequestPacer.none(), RequestPacer.none());
        IndicatorIngestService ingest = new IndicatorIngestService(
                List.of(StubProviders.indicators(ProviderId.FRED, true, ref -> Mono.just(List.of(cpi)))),
                new ReconciliationPipeline(orchestrator, new RecordMerger(), stats),
                new IndicatorSchema(), sink, new IngestProperties(), CLOCK, cacheEvictor);

        IngestSummary summary = ingest.run("US").block();
        assertNotNull(summary);
        assertTrue(summary.isSuccess());

        List<EconomicIndicator> after = queryService.indicators("CPI", "US").block();
        assertNotNull(after);
        assertEquals(1, after.size());
        assertEquals(313.5, after.get(0).getValue());
        verify(level2Cache).evict("indicators:*:US");
    }

    @Test
    void earningsEvictionOnlyTouchesStoredSymbol() {
        when(earningsRepository.findBySymbolOrderByReportedDateDesc(anyString())).thenReturn(Flux.empty());

        queryService.earnings("AAPL").block();
        queryService.earnings("MSFT").block();
        cacheEvictor.earningsStored("AAPL").block();
        queryService.earnings("AAPL").block();
        queryService.earnings("MSFT").block();

        verify(earningsRepository, times(2)).findBySymbolOrderByReportedDateDesc("AAPL");
        verify(earningsRepository, times(1)).findBySymbolOrderByReportedDateDesc("MSFT");
        verify(level2Cache).evict("earnings:AAPL");
    }
}
