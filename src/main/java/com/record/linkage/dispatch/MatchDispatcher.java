package com.record.linkage.dispatch;

import com.record.linkage.api.PairComparer;
import com.record.linkage.blocking.ChunkSink;
import com.record.linkage.core.model.CandidateChunk;
import com.record.linkage.core.model.RecordSet;
import com.record.linkage.core.model.ScoredPair;
import com.record.linkage.logging.LogContext;
import com.record.linkage.metrics.MatchMetrics;
import com.record.linkage.metrics.NoOpMatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scores candidate chunks on a fixed pool of worker threads.
 *
 * <p>Chunks are queued until the batch threshold is reached. The batch is then
 * submitted and the calling thread blocks until every chunk of it has been scored,
 * so at most one batch is in flight. The completed batch goes to the
 * {@link BatchListener} with chunks in queue order. {@link #flush()} submits the
 * trailing partial batch.</p>
 *
 * <p>A failing chunk is retried up to {@code chunkRetries} times; after that the
 * remaining chunks of the batch are cancelled and a {@link MatchExecutionException}
 * is thrown. Nothing of a failed batch reaches the listener.</p>
 */
public class MatchDispatcher implements ChunkSink, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MatchDispatcher.class);

    private final PairComparer comparer;
    private final RecordSet recordsA;
    private final RecordSet recordsB;
    private final DispatchPolicy policy;
    private final BatchListener listener;
    private final MatchMetrics metrics;
    private final ExecutorService executor;
    private final List<CandidateChunk> pending = new ArrayList<>();
    private int batchesSubmitted;
    private volatile boolean closed;

    public MatchDispatcher(PairComparer comparer, RecordSet recordsA, RecordSet recordsB,
                           DispatchPolicy policy, BatchListener listener) {
        this(comparer, recordsA, recordsB, policy, listener, new NoOpMatchMetrics());
    }

    public MatchDispatcher(PairComparer comparer, RecordSet recordsA, RecordSet recordsB,
                           DispatchPolicy policy, BatchListener listener, MatchMetrics metrics) {
        this.comparer = Objects.requireNonNull(comparer, "comparer is required");
        this.recordsA = Objects.requireNonNull(recordsA, "recordsA is required");
        this.recordsB = Objects.requireNonNull(recordsB, "recordsB is required");
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.listener = Objects.requireNonNull(listener, "listener is required");
        this.metrics = metrics != null ? metrics : new NoOpMatchMetrics();
        this.executor = Executors.newFixedThreadPool(policy.parallelism(), new WorkerThreadFactory());
    }

    /**
     * Queues a chunk, submitting the batch once the threshold is reached.
     * Empty chunks are ignored.
     */
    @Override
    public void accept(CandidateChunk chunk) {
        ensureOpen();
        if (chunk == null || chunk.pairs().isEmpty()) {
            return;
        }
        pending.add(chunk);
        if (pending.size() >= policy.batchThreshold()) {
            submitPending();
        }
    }

    /**
     * Submits the trailing partial batch, if any, and waits for it.
     */
    public void flush() {
        ensureOpen();
        if (!pending.isEmpty()) {
            submitPending();
        }
    }

    public int getBatchesSubmitted() {
        return batchesSubmitted;
    }

    public int getPendingChunkCount() {
        return pending.size();
    }

    private void submitPending() {
        List<CandidateChunk> batch = new ArrayList<>(pending);
        pending.clear();
        int batchIndex = batchesSubmitted++;
        metrics.recordBatchSize(batch.size());
        log.debug("batch.submitted batch={} chunks={}", batchIndex, batch.size());

        List<ScoredChunk> scored = execute(batchIndex, batch);
        listener.onBatch(batchIndex, scored);
    }

    private List<ScoredChunk> execute(int batchIndex, List<CandidateChunk> batch) {
        CompletionService<ScoredChunk> completion = new ExecutorCompletionService<>(executor);
        Map<Future<ScoredChunk>, Integer> positions = new HashMap<>();
        for (int i = 0; i < batch.size(); i++) {
            CandidateChunk chunk = batch.get(i);
            positions.put(completion.submit(() -> score(chunk)), i);
        }

        ScoredChunk[] results = new ScoredChunk[batch.size()];
        long deadline = policy.batchTimeout() != null
                ? System.nanoTime() + policy.batchTimeout().toNanos()
                : Long.MAX_VALUE;
        try {
            for (int received = 0; received < batch.size(); received++) {
                Future<ScoredChunk> done = nextCompleted(completion, deadline);
                if (done == null) {
                    cancelAll(positions);
                    throw new MatchExecutionException("Batch " + batchIndex + " exceeded timeout of "
                            + policy.batchTimeout() + " with " + (batch.size() - received) + " chunks outstanding");
                }
                results[positions.get(done)] = done.get();
            }
        } catch (ExecutionException e) {
            cancelAll(positions);
            metrics.incrementChunkFailed();
            log.error("batch.failed batch={} cause={}", batchIndex, e.getCause().toString());
            throw new MatchExecutionException("Scoring failed in batch " + batchIndex, e.getCause());
        } catch (InterruptedException e) {
            cancelAll(positions);
            Thread.currentThread().interrupt();
            throw new MatchExecutionException("Interrupted while waiting for batch " + batchIndex, e);
        }
        return Arrays.asList(results);
    }

    private static Future<ScoredChunk> nextCompleted(CompletionService<ScoredChunk> completion, long deadline)
            throws InterruptedException {
        if (deadline == Long.MAX_VALUE) {
            return completion.take();
        }
        long remaining = deadline - System.nanoTime();
        return remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : completion.poll();
    }

    private ScoredChunk score(CandidateChunk chunk) {
        try (LogContext ignored = LogContext.forChunk(chunk.passName(), chunk.sequence())) {
            int attempt = 0;
            while (true) {
                try {
                    List<ScoredPair> pairs = comparer.compare(chunk, recordsA, recordsB);
                    return new ScoredChunk(chunk.passName(), chunk.sequence(), pairs);
                } catch (RuntimeException e) {
                    if (attempt >= policy.chunkRetries() || Thread.currentThread().isInterrupted()) {
                        throw e;
                    }
                    attempt++;
                    metrics.incrementChunkRetried();
                    log.warn("chunk.retry pass={} chunk={} attempt={} cause={}",
                            chunk.passName(), chunk.sequence(), attempt, e.toString());
                }
            }
        }
    }

    private static void cancelAll(Map<Future<ScoredChunk>, Integer> futures) {
        for (Future<ScoredChunk> future : futures.keySet()) {
            future.cancel(true);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Dispatcher is closed");
        }
    }

    /**
     * Shuts the worker pool down. Chunks still queued are discarded; call
     * {@link #flush()} first to score them.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!pending.isEmpty()) {
            log.warn("dispatcher.closed discardedChunks={}", pending.size());
            pending.clear();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "match-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
