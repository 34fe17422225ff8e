package com.example.finrecon.service;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.model.ProviderOutcome;
import com.example.finrecon.model.ReconciledRecord;
import com.example.finrecon.provider.ProviderAdapter;
import com.example.finrecon.provider.RequestPacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 어댑터 동시 실행(settle-all)과 엔티티 배치 처리를 담당한다.
 *
 * <p>One adapter's error, empty result or timeout only marks that provider as failed; siblings keep
 * running and the orchestrator waits for all of them. There is no run-wide deadline, only the
 * per-adapter timeout.</p>
 */
@Component
public class FetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final Duration adapterTimeout;
    private final int batchSize;
    private final RequestPacer batchPacer;
    private final RequestPacer entityPacer;

    @Autowired
    public FetchOrchestrator(IngestProperties props) {
        this(props.getAdapterTimeout(), props.getBatchSize(),
                RequestPacer.fixed(props.getBatchDelay()), RequestPacer.fixed(props.getEntityDelay()));
    }

    public FetchOrchestrator(Duration adapterTimeout, int batchSize, RequestPacer batchPacer, RequestPacer entityPacer) {
        this.adapterTimeout = adapterTimeout;
        this.batchSize = batchSize < 1 ? 1 : batchSize;
        this.batchPacer = batchPacer;
        this.entityPacer = entityPacer;
    }

    public <R extends ReconciledRecord> Mono<SettledResults<R>> settle(EntityRef ref, DateRange window,
                                                                      List<? extends ProviderAdapter<R>> adapters) {
        if (adapters == null || adapters.isEmpty()) return Mono.just(SettledResults.empty());
        List<Mono<SettledResults.Slice<R>>> calls = new ArrayList<>(adapters.size());
        for (ProviderAdapter<R> adapter : adapters) {
            calls.add(settleOne(adapter, ref, window));
        }
        // every inner Mono emits exactly one slice, so zip never short-circuits
        return Mono.zip(calls, arr -> {
            List<SettledResults.Slice<R>> slices = new ArrayList<>(arr.length);
            for (Object o : arr) {
                @SuppressWarnings("unchecked")
                SettledResults.Slice<R> slice = (SettledResults.Slice<R>) o;
                slices.add(slice);
            }
            SettledResults<R> settled = new SettledResults<>(slices);
            log.debug("{}: {}/{} provider(s) returned data", ref, settled.succeeded(), settled.dispatched());
            return settled;
        });
    }

    private <R extends ReconciledRecord> Mono<SettledResults.Slice<R>> settleOne(ProviderAdapter<R> adapter,
                                                                                EntityRef ref, DateRange window) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return Mono.defer(() -> adapter.fetch(ref, window))
                    .timeout(adapterTimeout)
                    .map(list -> list.isEmpty()
                            ? new SettledResults.Slice<R>(ProviderOutcome.failed(adapter.id(), elapsedMs(started), "no data"), List.of())
                            : new SettledResults.Slice<R>(ProviderOutcome.success(adapter.id(), list.size(), elapsedMs(started)), list))
                    .defaultIfEmpty(new SettledResults.Slice<R>(ProviderOutcome.failed(adapter.id(), elapsedMs(started), "no data"), List.of()))
                    .onErrorResume(TimeoutException.class, e -> {
                        log.warn("{} timed out after {} for {}", adapter.id().code(), adapterTimeout, ref);
                        return Mono.just(new SettledResults.Slice<R>(ProviderOutcome.timeout(adapter.id(), elapsedMs(started)), List.of()));
                    })
                    .onErrorResume(e -> {
                        log.warn("{} failed for {}: {}", adapter.id().code(), ref, e.toString());
                        return Mono.just(new SettledResults.Slice<R>(ProviderOutcome.failed(adapter.id(), elapsedMs(started), e.toString()), List.of()));
                    });
        });
    }

    /**
     * 엔티티 목록을 배치로 나눠 순차 처리한다. 배치 사이와 엔티티 사이에 대기 시간을 둔다.
     * 한 엔티티의 실패는 {@code onFailure} 결과로 바뀌어 나머지 처리를 막지 않는다.
     */
    public <E, T> Flux<T> inBatches(List<E> entities, Function<E, Mono<T>> task, BiFunction<E, Throwable, T> onFailure) {
        if (entities == null || entities.isEmpty()) return Flux.empty();
        List<List<E>> batches = new ArrayList<>();
        for (int i = 0; i < entities.size(); i += batchSize) {
            batches.add(entities.subList(i, Math.min(i + batchSize, entities.size())));
        }
        int total = batches.size();
        return Flux.range(0, total)
                .concatMap(b -> {
                    Mono<Void> gap = b == 0 ? Mono.empty() : batchPacer.pause();
                    return gap.thenMany(Flux.defer(() -> {
                        log.info("Processing batch {} of {}", b + 1, total);
                        return entityPacer.sequence(batches.get(b), entity -> isolate(entity, task, onFailure));
                    }));
                });
    }

    private static <E, T> Mono<T> isolate(E entity, Function<E, Mono<T>> task, BiFunction<E, Throwable, T> onFailure) {
        return Mono.defer(() -> task.apply(entity))
                .onErrorResume(e -> {
                    log.warn("Entity {} failed: {}", entity, e.toString());
                    return Mono.fromSupplier(() -> onFailure.apply(entity, e));
                });
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
