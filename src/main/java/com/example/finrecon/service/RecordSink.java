package com.example.finrecon.service;

import com.example.finrecon.model.ReconciledRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 병합 결과 저장소. 충돌 키 기준 upsert 이며 실패는 예외 대신 false 로 알린다.
 */
public interface RecordSink<R extends ReconciledRecord> {

    /** Emits true when every record was written (an empty list counts as written). */
    Mono<Boolean> upsert(List<R> records);
}
