package com.example.finrecon.service;

import com.example.finrecon.model.ProviderOutcome;
import com.example.finrecon.model.doc.ProviderStats;
import com.example.finrecon.repo.ProviderStatsRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 제공자별 호출 통계를 누적한다. 기록 실패는 로그만 남기고 수집 실행에는 영향을 주지 않는다.
 */
@Service
@RequiredArgsConstructor
public class ProviderStatsRecorder {

    private static final Logger log = LoggerFactory.getLogger(ProviderStatsRecorder.class);
    static final int MAX_CONFLICT_RETRIES = 5;

    private final ProviderStatsRepository repository;
    private final Clock clock;

    public Mono<Void> record(List<ProviderOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) return Mono.empty();
        Instant now = clock.instant();
        return Flux.fromIterable(outcomes)
                .concatMap(o -> recordOne(o, now))
                .then()
                .onErrorResume(e -> {
                    log.warn("Provider stats update failed: {}", e.toString());
                    return Mono.empty();
                });
    }

    /**
     * Read-modify-write of one provider's document. A concurrent writer bumps {@code version} (or inserts the same id
     * first), in which case the document is re-read and the outcome applied again.
     */
    private Mono<ProviderStats> recordOne(ProviderOutcome o, Instant now) {
        String code = o.getProvider().code();
        return Mono.defer(() -> repository.findById(code)
                        .switchIfEmpty(Mono.fromSupplier(() -> fresh(code)))
                        .map(s -> apply(s, o, now))
                        .flatMap(repository::save))
                .retryWhen(Retry.max(MAX_CONFLICT_RETRIES)
                        .filter(ProviderStatsRecorder::isWriteConflict)
                        .doBeforeRetry(rs -> log.debug("Provider stats for {} changed concurrently, retrying", code)));
    }

    static boolean isWriteConflict(Throwable e) {
        return e instanceof OptimisticLockingFailureException || e instanceof DuplicateKeyException;
    }

    public Flux<ProviderStats> all() {
        return repository.findAll();
    }

    static ProviderStats fresh(String provider) {
        ProviderStats s = new ProviderStats();
        s.setId(provider);
        return s;
    }

    /** Folds one outcome into the running counters. Average response time covers successful attempts only. */
    static ProviderStats apply(ProviderStats s, ProviderOutcome o, Instant now) {
        s.setTotalAttempts(s.getTotalAttempts() + 1);
        if (o.isSuccess()) {
            long prior = s.getSuccessfulAttempts();
            s.setAvgResponseTimeMs((s.getAvgResponseTimeMs() * prior + o.getElapsedMs()) / (prior + 1));
            s.setSuccessfulAttempts(prior + 1);
            s.setConsecutiveFailures(0);
            s.setLastSuccess(now);
        } else {
            s.setFailedAttempts(s.getFailedAttempts() + 1);
            s.setConsecutiveFailures(s.getConsecutiveFailures() + 1);
            s.setLastFailure(now);
        }
        s.setUpdatedAt(now);
        return s;
    }
}
