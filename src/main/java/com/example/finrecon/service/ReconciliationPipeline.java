package com.example.finrecon.service;

import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.model.ReconciledRecord;
import com.example.finrecon.provider.ProviderAdapter;
import com.example.finrecon.service.merge.RecordMerger;
import com.example.finrecon.service.merge.RecordSchema;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 엔티티 하나에 대해 어댑터 settle → 통계 기록 → 병합/파생 → upsert 를 수행한다.
 * 지표/실적 파이프라인이 같은 흐름을 공유한다.
 */
@Service
@RequiredArgsConstructor
public class ReconciliationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationPipeline.class);

    private final FetchOrchestrator orchestrator;
    private final RecordMerger merger;
    private final ProviderStatsRecorder stats;

    public <R extends ReconciledRecord> Mono<PipelineResult<R>> run(EntityRef ref, DateRange window,
                                                                   List<? extends ProviderAdapter<R>> adapters,
                                                                   RecordSchema<R> schema, RecordSink<R> sink) {
        return orchestrator.settle(ref, window, adapters)
                .flatMap(settled -> stats.record(settled.outcomes()).thenReturn(settled))
                .flatMap(settled -> {
                    if (settled.succeeded() == 0) {
                        log.warn("{}: no data from any of {} provider(s)", ref, settled.dispatched());
                        return Mono.just(new PipelineResult<>(settled, List.of(), PipelineResult.Outcome.NO_PROVIDER_DATA));
                    }
                    List<R> merged = merger.merge(schema, settled.records());
                    if (merged.isEmpty()) {
                        log.warn("{}: provider data had no complete record", ref);
                        return Mono.just(new PipelineResult<>(settled, merged, PipelineResult.Outcome.NO_VALID_RECORDS));
                    }
                    return sink.upsert(merged)
                            .defaultIfEmpty(false)
                            .map(ok -> new PipelineResult<>(settled, merged,
                                    ok ? PipelineResult.Outcome.STORED : PipelineResult.Outcome.SAVE_FAILED));
                });
    }
}
