package com.example.finrecon.service;

import com.example.finrecon.model.ProviderOutcome;
import com.example.finrecon.model.ReconciledRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 모든 어댑터가 끝난(성공 또는 실패) 뒤의 결과. 슬라이스 순서는 디스패치 순서와 같다.
 */
public class SettledResults<R extends ReconciledRecord> {

    private final List<Slice<R>> slices;

    public SettledResults(List<Slice<R>> slices) {
        this.slices = Collections.unmodifiableList(new ArrayList<>(slices));
    }

    public static <R extends ReconciledRecord> SettledResults<R> empty() {
        return new SettledResults<>(List.of());
    }

    public List<Slice<R>> slices() {
        return slices;
    }

    public List<ProviderOutcome> outcomes() {
        List<ProviderOutcome> out = new ArrayList<>(slices.size());
        for (Slice<R> s : slices) out.add(s.outcome());
        return out;
    }

    public int dispatched() {
        return slices.size();
    }

    public int succeeded() {
        int n = 0;
        for (Slice<R> s : slices) if (s.outcome().isSuccess()) n++;
        return n;
    }

    /** Records of successful providers, flattened in dispatch order. */
    public List<R> records() {
        List<R> out = new ArrayList<>();
        for (Slice<R> s : slices) {
            if (s.outcome().isSuccess()) out.addAll(s.records());
        }
        return out;
    }

    public static final class Slice<R> {
        private final ProviderOutcome outcome;
        private final List<R> records;

        public Slice(ProviderOutcome outcome, List<R> records) {
            this.outcome = outcome;
            this.records = records == null ? List.of() : records;
        }

        public ProviderOutcome outcome() { return outcome; }

        public List<R> records() { return records; }
    }
}
