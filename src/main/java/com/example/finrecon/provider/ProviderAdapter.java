package com.example.finrecon.provider;

import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.model.ReconciledRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 외부 제공자 하나에 대한 어댑터. 원시 응답을 정규 레코드의 부분 레코드 목록으로 바꾼다.
 *
 * <p>{@link #fetch} never signals an error: a failed sub-call contributes nothing, and when the whole
 * invocation yields no record the returned {@code Mono} completes empty.</p>
 */
public interface ProviderAdapter<R extends ReconciledRecord> {

    ProviderId id();

    /** False when the provider has no credentials configured. */
    boolean isEnabled();

    Mono<List<R>> fetch(EntityRef ref, DateRange window);
}
