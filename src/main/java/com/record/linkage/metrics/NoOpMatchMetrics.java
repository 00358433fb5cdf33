package com.record.linkage.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MatchMetrics}.
 */
public class NoOpMatchMetrics implements MatchMetrics {

    @Override
    public void recordPassDuration(String passName, Duration duration) {
    }

    @Override
    public void recordCandidates(String passName, long candidates) {
    }

    @Override
    public void incrementPassSkipped(String passName) {
    }

    @Override
    public void recordBatchSize(int chunks) {
    }

    @Override
    public void incrementChunkRetried() {
    }

    @Override
    public void incrementChunkFailed() {
    }

    @Override
    public void recordShardWritten(long rows) {
    }
}
