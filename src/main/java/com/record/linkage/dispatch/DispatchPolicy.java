package com.record.linkage.dispatch;

import java.time.Duration;

/**
 * Worker pool sizing and batch submission policy.
 *
 * @param parallelism    number of worker threads
 * @param batchThreshold pending chunks that trigger a batch submission
 * @param chunkRetries   extra attempts for a failing chunk before the run aborts
 * @param batchTimeout   maximum wall time of one batch, or {@code null} for none
 */
public record DispatchPolicy(int parallelism, int batchThreshold, int chunkRetries, Duration batchTimeout) {

    public DispatchPolicy {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        if (batchThreshold < 1) {
            throw new IllegalArgumentException("batchThreshold must be at least 1");
        }
        if (chunkRetries < 0) {
            throw new IllegalArgumentException("chunkRetries must be >= 0");
        }
        if (batchTimeout != null && (batchTimeout.isNegative() || batchTimeout.isZero())) {
            throw new IllegalArgumentException("batchTimeout must be positive");
        }
    }

    /**
     * Policy with a batch threshold of twice the pool size, no retries and no timeout.
     */
    public static DispatchPolicy of(int parallelism) {
        return new DispatchPolicy(parallelism, 2 * parallelism, 0, null);
    }
}
