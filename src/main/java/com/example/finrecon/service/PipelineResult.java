package com.example.finrecon.service;

import com.example.finrecon.model.ReconciledRecord;

import java.util.List;

/**
 * 한 엔티티에 대한 settle → merge → upsert 결과.
 */
public class PipelineResult<R extends ReconciledRecord> {

    public enum Outcome {
        STORED("stored"),
        NO_PROVIDER_DATA("No data from any provider"),
        NO_VALID_RECORDS("No valid records after merge"),
        SAVE_FAILED("Failed to save to database");

        private final String message;

        Outcome(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final SettledResults<R> settled;
    private final List<R> merged;
    private final Outcome outcome;

    public PipelineResult(SettledResults<R> settled, List<R> merged, Outcome outcome) {
        this.settled = settled;
        this.merged = merged == null ? List.of() : merged;
        this.outcome = outcome;
    }

    public SettledResults<R> settled() { return settled; }

    public List<R> merged() { return merged; }

    public Outcome outcome() { return outcome; }

    public boolean stored() { return outcome == Outcome.STORED; }
}
