package com.example.finrecon.service;

import com.example.finrecon.model.ReconciledRecord;
import com.example.finrecon.service.merge.RecordSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Mongo 리포지토리 기반 sink. 문서 id 를 충돌 키 값으로 정하므로 save 가 곧 upsert 다.
 */
public class RepositoryRecordSink<R extends ReconciledRecord> implements RecordSink<R> {

    private static final Logger log = LoggerFactory.getLogger(RepositoryRecordSink.class);

    private final ReactiveCrudRepository<R, String> repository;
    private final RecordSchema<R> schema;
    private final String collection;

    public RepositoryRecordSink(ReactiveCrudRepository<R, String> repository, RecordSchema<R> schema, String collection) {
        this.repository = repository;
        this.schema = schema;
        this.collection = collection;
    }

    @Override
    public Mono<Boolean> upsert(List<R> records) {
        if (records == null || records.isEmpty()) return Mono.just(true);
        return Mono.defer(() -> {
                    for (R r : records) r.setId(schema.conflictId(r));
                    return repository.saveAll(records).count();
                })
                .map(written -> {
                    log.debug("Upserted {} record(s) into {} on {}", written, collection, schema.conflictKey());
                    return true;
                })
                .onErrorResume(e -> {
                    log.error("Upsert into {} failed: {}", collection, e.toString());
                    return Mono.just(false);
                });
    }
}
