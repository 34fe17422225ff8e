package com.example.finrecon.service.merge;

import com.example.finrecon.model.ReconciledRecord;

import java.util.List;

/**
 * Describes one canonical record type to the generic {@link RecordMerger}.
 */
public interface RecordSchema<R extends ReconciledRecord> {

    /** Every mergeable field, key fields included. */
    List<MergeField<R, ?>> fields();

    R newRecord();

    /** Fills defaults for fields no provider populated. */
    void applyDefaults(R record);

    /** Metrics computable from the record alone (surprise, margins...). */
    void deriveRecordMetrics(R record);

    /**
     * Metrics that need other periods of the same series.
     *
     * @param newestFirst one series, ordered by period date descending
     */
    void deriveSeriesMetrics(List<R> newestFirst);

    /** Field names forming the persistence conflict target. */
    List<String> conflictKey();

    /** Document id built from the conflict key values. */
    String conflictId(R record);
}
