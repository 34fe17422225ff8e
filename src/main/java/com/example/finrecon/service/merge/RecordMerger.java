package com.example.finrecon.service.merge;

import com.example.finrecon.model.ReconciledRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 여러 제공자의 부분 레코드를 자연키 단위로 병합한다.
 *
 * <ol>
 *   <li>키 필드가 빠진 부분 레코드는 버린다.</li>
 *   <li>자연키로 묶고 도착 순서대로 접는다. 먼저 채워진 필드는 덮어쓰지 않고 빈 필드만 채운다.</li>
 *   <li>출처는 순서를 유지하며 누적한다.</li>
 *   <li>기본값, 레코드 단위 파생 지표를 적용한다.</li>
 *   <li>기간 내림차순 정렬 후 시리즈 단위 파생 지표(직전 대비 변화 등)를 계산한다.</li>
 * </ol>
 *
 * Single-threaded; callers pass the fully collected partials in a fixed fold order.
 */
@Component
public class RecordMerger {

    private static final Logger log = LoggerFactory.getLogger(RecordMerger.class);

    static final String UNKNOWN_PROVIDER = "unknown";

    public <R extends ReconciledRecord> List<R> merge(RecordSchema<R> schema, List<? extends R> partials) {
        if (partials == null || partials.isEmpty()) return new ArrayList<>();

        Map<String, R> byKey = new LinkedHashMap<>();
        int dropped = 0;
        for (R partial : partials) {
            String key = partial == null ? null : partial.naturalKey();
            if (key == null) {
                dropped++;
                continue;
            }
            R acc = byKey.computeIfAbsent(key, k -> schema.newRecord());
            for (MergeField<R, ?> field : schema.fields()) {
                field.fill(acc, partial);
            }
            if (partial.getProviders() == null || partial.getProviders().isEmpty()) {
                acc.addProvider(UNKNOWN_PROVIDER);
            } else {
                acc.addProviders(partial.getProviders());
            }
        }
        if (dropped > 0) log.debug("Dropped {} partial record(s) without a complete natural key", dropped);

        List<R> merged = new ArrayList<>(byKey.values());
        for (R r : merged) {
            schema.applyDefaults(r);
            schema.deriveRecordMetrics(r);
            r.renderProvenance();
        }

        // List.sort is stable: ties keep first-arrival order
        merged.sort(Comparator.comparing(ReconciledRecord::periodDate, Comparator.nullsLast(Comparator.reverseOrder())));

        Map<String, List<R>> series = new LinkedHashMap<>();
        for (R r : merged) {
            series.computeIfAbsent(r.seriesKey(), k -> new ArrayList<>()).add(r);
        }
        for (List<R> group : series.values()) {
            schema.deriveSeriesMetrics(group);
        }

        log.debug("Merged {} partial record(s) into {} canonical record(s)", partials.size() - dropped, merged.size());
        return merged;
    }
}
