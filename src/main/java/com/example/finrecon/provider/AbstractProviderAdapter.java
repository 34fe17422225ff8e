package com.example.finrecon.provider;

import com.example.finrecon.model.ProviderId;
import com.example.finrecon.model.ReconciledRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * 어댑터 공통 부분: 제공자 식별자, 호출 간격, 하위 호출 단위 실패 격리.
 */
public abstract class AbstractProviderAdapter<R extends ReconciledRecord> implements ProviderAdapter<R> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final ProviderId id;
    protected final RequestPacer pacer;

    protected AbstractProviderAdapter(ProviderId id, RequestPacer pacer) {
        this.id = id;
        this.pacer = pacer == null ? RequestPacer.none() : pacer;
    }

    @Override
    public ProviderId id() {
        return id;
    }

    /**
     * Runs one sub-call per item, one after another with the pacer's gap in between, and concatenates
     * their records. A failing or empty sub-call contributes nothing. Completes empty when no sub-call
     * produced a record.
     */
    protected <S> Mono<List<R>> gather(List<S> subCalls, Function<S, Mono<List<R>>> call) {
        return pacer.sequence(subCalls, s -> guard(String.valueOf(s), Mono.defer(() -> call.apply(s))))
                .concatMapIterable(Function.identity())
                .collectList()
                .filter(list -> !list.isEmpty())
                .doOnNext(list -> log.debug("{} produced {} partial record(s)", id.code(), list.size()));
    }

    /** Isolates one sub-call: its error is logged and turned into an empty completion. */
    protected <T> Mono<T> guard(String subCall, Mono<T> call) {
        return call.onErrorResume(e -> {
            log.warn("{} {} failed: {}", id.code(), subCall, e.toString());
            return Mono.empty();
        });
    }

    protected R stamp(R record) {
        record.addProvider(id.code());
        return record;
    }
}
