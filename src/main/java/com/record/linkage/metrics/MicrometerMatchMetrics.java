package com.record.linkage.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MatchMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code linkage.pass.duration} - Timer (tag: pass)</li>
 *   <li>{@code linkage.pass.candidates} - Counter (tag: pass)</li>
 *   <li>{@code linkage.pass.skipped} - Counter (tag: pass)</li>
 *   <li>{@code linkage.batch.chunks} - DistributionSummary</li>
 *   <li>{@code linkage.chunk.retried} - Counter</li>
 *   <li>{@code linkage.chunk.failed} - Counter</li>
 *   <li>{@code linkage.shard.rows} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMatchMetrics implements MatchMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchChunksSummary;
    private final DistributionSummary shardRowsSummary;
    private final Counter chunkRetriedCounter;
    private final Counter chunkFailedCounter;

    public MicrometerMatchMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.batchChunksSummary = DistributionSummary.builder("linkage.batch.chunks")
                .description("Number of chunks per dispatched batch")
                .register(registry);
        this.shardRowsSummary = DistributionSummary.builder("linkage.shard.rows")
                .description("Number of result rows per written shard")
                .register(registry);
        this.chunkRetriedCounter = Counter.builder("linkage.chunk.retried")
                .description("Number of chunk scoring retries")
                .register(registry);
        this.chunkFailedCounter = Counter.builder("linkage.chunk.failed")
                .description("Number of chunks that failed scoring")
                .register(registry);
    }

    @Override
    public void recordPassDuration(String passName, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(passName, k ->
                Timer.builder("linkage.pass.duration")
                        .description("Duration of a blocking pass including streaming")
                        .tag("pass", passName)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCandidates(String passName, long candidates) {
        passCounter("candidates:", "linkage.pass.candidates", "Number of candidate pairs generated", passName)
                .increment(candidates);
    }

    @Override
    public void incrementPassSkipped(String passName) {
        passCounter("skipped:", "linkage.pass.skipped", "Number of skipped passes", passName)
                .increment();
    }

    @Override
    public void recordBatchSize(int chunks) {
        batchChunksSummary.record(chunks);
    }

    @Override
    public void incrementChunkRetried() {
        chunkRetriedCounter.increment();
    }

    @Override
    public void incrementChunkFailed() {
        chunkFailedCounter.increment();
    }

    @Override
    public void recordShardWritten(long rows) {
        shardRowsSummary.record(rows);
    }

    private Counter passCounter(String prefix, String name, String description, String passName) {
        return counterCache.computeIfAbsent(prefix + passName, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("pass", passName)
                        .register(registry));
    }
}
