package com.record.linkage.dispatch;

import java.util.List;

/**
 * Receives each completed batch on the coordinator thread, in submission order.
 */
@FunctionalInterface
public interface BatchListener {

    /**
     * @param batchIndex 0-based index of the batch within the run
     * @param chunks     scored chunks in the order they were queued
     */
    void onBatch(int batchIndex, List<ScoredChunk> chunks);
}
