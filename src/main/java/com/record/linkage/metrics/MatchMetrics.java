package com.record.linkage.metrics;

import java.time.Duration;

/**
 * Interface for recording matching-run metrics.
 * The default {@link NoOpMatchMetrics} does nothing; {@link MicrometerMatchMetrics}
 * publishes to a Micrometer registry.
 */
public interface MatchMetrics {

    void recordPassDuration(String passName, Duration duration);

    void recordCandidates(String passName, long candidates);

    void incrementPassSkipped(String passName);

    void recordBatchSize(int chunks);

    void incrementChunkRetried();

    void incrementChunkFailed();

    void recordShardWritten(long rows);
}
