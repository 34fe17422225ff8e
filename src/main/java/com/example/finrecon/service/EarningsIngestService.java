package com.example.finrecon.service;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.exception.NoProviderConfiguredException;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.EntityOutcome;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.model.IngestSummary;
import com.example.finrecon.provider.EarningsProvider;
import com.example.finrecon.service.cache.QueryCacheEvictor;
import com.example.finrecon.service.merge.EarningsSchema;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 실적 수집: 심볼 목록을 배치로 나눠 심볼마다 모든 실적 제공자를 settle 하고 병합 결과를 저장한다.
 * 한 심볼의 실패는 다른 심볼에 영향을 주지 않는다.
 */
@Service
@RequiredArgsConstructor
public class EarningsIngestService {

    private static final Logger log = LoggerFactory.getLogger(EarningsIngestService.class);

    static final String COMPLETED = "Earnings data multi-provider fetch completed";
    static final String NO_SYMBOLS = "No symbols to process";

    private final List<EarningsProvider> adapters;
    private final ReconciliationPipeline pipeline;
    private final FetchOrchestrator orchestrator;
    private final EarningsSchema schema;
    private final RecordSink<EarningsReport> earningsSink;
    private final IngestProperties props;
    private final QueryCacheEvictor cacheEvictor;

    /**
     * @param symbols symbols to ingest; when null or empty the configured universe is used
     */
    public Mono<IngestSummary> run(List<String> symbols) {
        return Mono.defer(() -> {
            List<String> universe = normalize(symbols == null || symbols.isEmpty() ? props.getEarnings().getSymbols() : symbols);
            if (universe.isEmpty()) {
                IngestSummary s = new IngestSummary();
                s.setSuccess(false);
                s.setMessage(NO_SYMBOLS);
                s.getSummary().setProcessed(0);
                return Mono.just(s);
            }
            List<EarningsProvider> enabled = adapters.stream().filter(EarningsProvider::isEnabled).toList();
            if (enabled.isEmpty()) return Mono.error(new NoProviderConfiguredException("earnings"));

            log.info("Starting earnings fetch for {} symbol(s) with {} provider(s)", universe.size(), enabled.size());
            return orchestrator.inBatches(universe,
                            symbol -> processSymbol(symbol, enabled),
                            (symbol, e) -> EntityOutcome.error(symbol, String.valueOf(e.getMessage())))
                    .collectList()
                    .map(outcomes -> summarize(universe.size(), outcomes, props.getResultsLimit()));
        });
    }

    private Mono<EntityOutcome> processSymbol(String symbol, List<EarningsProvider> enabled) {
        log.info("Fetching earnings data for {}...", symbol);
        return pipeline.run(EntityRef.symbol(symbol), null, enabled, schema, earningsSink)
                .flatMap(result -> result.stored()
                        ? cacheEvictor.earningsStored(symbol).thenReturn(result)
                        : Mono.just(result))
                .map(result -> result.stored()
                        ? EntityOutcome.success(symbol, result.merged().size(), result.settled().succeeded())
                        : EntityOutcome.error(symbol, result.outcome().message()));
    }

    static IngestSummary summarize(int totalEntities, List<EntityOutcome> outcomes, int resultsLimit) {
        IngestSummary s = new IngestSummary();
        s.setSuccess(true);
        s.setMessage(COMPLETED);
        s.setResults(new ArrayList<>());
        IngestSummary.Counts c = s.getSummary();
        int successful = 0;
        int errors = 0;
        int records = 0;
        for (EntityOutcome o : outcomes) {
            if (o.isSuccess()) {
                successful++;
                records += o.getRecords() == null ? 0 : o.getRecords();
            } else {
                errors++;
            }
            s.addResult(o, resultsLimit);
        }
        c.setTotalEntities(totalEntities);
        c.setProcessed(outcomes.size());
        c.setSuccessful(successful);
        c.setErrors(errors);
        c.setTotalRecords(records);
        log.info("Earnings fetch done: {} processed, {} successful, {} error(s), {} record(s)",
                outcomes.size(), successful, errors, records);
        return s;
    }

    static List<String> normalize(List<String> symbols) {
        Set<String> out = new LinkedHashSet<>();
        if (symbols != null) {
            for (String raw : symbols) {
                if (raw == null) continue;
                for (String part : raw.split(",")) {
                    String t = part.trim().toUpperCase(Locale.ROOT);
                    if (!t.isEmpty()) out.add(t);
                }
            }
        }
        return new ArrayList<>(out);
    }
}
