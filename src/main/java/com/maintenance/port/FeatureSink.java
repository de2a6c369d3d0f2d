package com.maintenance.port;

import com.maintenance.domain.FeatureRecord;

import java.util.List;

/**
 * Destinations of computed features.
 */
public interface FeatureSink {

    /**
     * Appends records to the training store. Rewriting the same
     * (machine, window) replaces the earlier row instead of duplicating it.
     */
    void writeBatch(List<FeatureRecord> records);

    /**
     * Upserts records into the serving store, keyed by machine id.
     */
    void upsertBatch(List<FeatureRecord> records);
}
