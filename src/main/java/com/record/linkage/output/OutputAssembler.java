package com.record.linkage.output;

import com.record.linkage.blocking.ChunkSink;
import com.record.linkage.core.model.CandidateChunk;
import com.record.linkage.core.model.CandidatePair;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.ScoredPair;
import com.record.linkage.dispatch.BatchListener;
import com.record.linkage.dispatch.ScoredChunk;
import com.record.linkage.metrics.MatchMetrics;
import com.record.linkage.metrics.NoOpMatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns completed batches into weighted, sorted shards {@code match_<batch>.csv}
 * and streams ground-truth pairs into {@code match_ground_truth.csv}.
 */
public class OutputAssembler implements BatchListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OutputAssembler.class);

    public static final String GROUND_TRUTH_SHARD = "match_ground_truth.csv";

    private final ShardWriter writer;
    private final WeightScheme weights;
    private final PassCounts counts;
    private final MatchMetrics metrics;
    private final List<Path> shards = new ArrayList<>();
    private ShardWriter.Shard groundTruthShard;

    public OutputAssembler(ShardWriter writer, WeightScheme weights) {
        this(writer, weights, new PassCounts(), new NoOpMatchMetrics());
    }

    public OutputAssembler(ShardWriter writer, WeightScheme weights, PassCounts counts, MatchMetrics metrics) {
        this.writer = writer;
        this.weights = weights;
        this.counts = counts;
        this.metrics = metrics != null ? metrics : new NoOpMatchMetrics();
    }

    @Override
    public void onBatch(int batchIndex, List<ScoredChunk> chunks) {
        List<MatchResult> results = new ArrayList<>();
        for (ScoredChunk chunk : chunks) {
            double weight = weights.weightFor(chunk.passName());
            for (ScoredPair scored : chunk.pairs()) {
                results.add(MatchResult.of(scored, chunk.passName(), weight));
            }
        }
        counts.tallyAll(results);
        results.sort(Comparator.comparingDouble(MatchResult::weight).reversed());

        Path shard = writer.writeShard("match_" + batchIndex + ".csv", results);
        shards.add(shard);
        metrics.recordShardWritten(results.size());
        log.info("shard.written batch={} rows={} file={}", batchIndex, results.size(), shard.getFileName());
    }

    /**
     * Sink for ground-truth chunks. Pairs are not scored; each one is flagged in
     * every tier and appended to the ground-truth shard as it arrives.
     */
    public ChunkSink groundTruthSink() {
        return this::appendGroundTruth;
    }

    private void appendGroundTruth(CandidateChunk chunk) {
        if (chunk.pairs().isEmpty()) {
            return;
        }
        if (groundTruthShard == null) {
            groundTruthShard = writer.openShard(GROUND_TRUTH_SHARD);
            shards.add(groundTruthShard.getPath());
        }
        double weight = weights.weightFor(chunk.passName());
        List<MatchResult> results = new ArrayList<>(chunk.size());
        for (CandidatePair pair : chunk.pairs()) {
            results.add(MatchResult.groundTruth(pair, chunk.passName(), weight));
        }
        counts.tallyAll(results);
        groundTruthShard.append(results);
        metrics.recordShardWritten(results.size());
    }

    /**
     * Shard files written so far, in creation order.
     */
    public List<Path> getShards() {
        return List.copyOf(shards);
    }

    public PassCounts getCounts() {
        return counts;
    }

    @Override
    public void close() {
        if (groundTruthShard != null) {
            log.info("shard.written file={} rows={}", GROUND_TRUTH_SHARD, groundTruthShard.getRowCount());
            groundTruthShard.close();
            groundTruthShard = null;
        }
    }
}
