package com.record.linkage.blocking;

import com.record.linkage.core.model.CandidateChunk;
import com.record.linkage.core.model.CandidatePair;
import com.record.linkage.logging.LogContext;
import com.record.linkage.metrics.MatchMetrics;
import com.record.linkage.metrics.NoOpMatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the blocking plan pass by pass.
 *
 * <p>Ground-truth passes run first, then numbered passes in ascending order. For each
 * pass the orchestrator resolves its variables, asks the backend for candidates using
 * the committed exclusion state, commits the returned state, and streams the
 * candidate set in chunks of the pass's chunk size to a sink. A pass with no or
 * unmapped variables, or without a candidate set, is skipped and the run continues.</p>
 */
public class PassOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PassOrchestrator.class);

    private final MatchContext context;
    private final MatchMetrics metrics;

    public PassOrchestrator(MatchContext context) {
        this(context, new NoOpMatchMetrics());
    }

    public PassOrchestrator(MatchContext context, MatchMetrics metrics) {
        this.context = context;
        this.metrics = metrics != null ? metrics : new NoOpMatchMetrics();
    }

    /**
     * Runs every pass of the plan.
     *
     * @param plan            the blocking plan
     * @param groundTruthSink receives chunks of ground-truth passes
     * @param numberedSink    receives chunks of numbered passes
     * @return one report per pass, in execution order
     */
    public List<PassReport> run(BlockingPlan plan, ChunkSink groundTruthSink, ChunkSink numberedSink) {
        List<PassReport> reports = new ArrayList<>();
        for (PassDefinition pass : plan.orderedPasses()) {
            ChunkSink sink = pass.isGroundTruth() ? groundTruthSink : numberedSink;
            reports.add(runPass(pass, sink));
        }
        return reports;
    }

    /**
     * Runs a single pass against the current exclusion state.
     */
    public PassReport runPass(PassDefinition pass, ChunkSink sink) {
        try (LogContext ignored = LogContext.forPass(context.getRunId(), pass.name())) {
            long start = System.nanoTime();
            PassState state = advance(PassState.PENDING, PassState.GENERATING);

            PassResolution resolution = context.resolve(pass);
            if (resolution.hasNoVariables()) {
                log.info("pass.skipped pass={} reason=no-blocking-variables", pass.name());
                return skipped(pass, state, 0, start, "no blocking variables");
            }
            if (!resolution.isResolved()) {
                log.warn("pass.skipped pass={} reason=unmapped-variables missing={}",
                        pass.name(), resolution.missingFields());
                return skipped(pass, state, 0, start,
                        "variables not mapped on both sides: " + resolution.missingFields());
            }

            BlockingKey key = resolution.key();
            log.info("pass.generating pass={} backend={} columnsA={} columnsB={} priorKeys={}",
                    pass.name(), context.getBackend().getName(), key.columnsA(), key.columnsB(),
                    context.getExclusion().priorKeys().size());

            CandidateRequest request = new CandidateRequest(pass, key, context.getExclusion(),
                    context.isDedup(), context.candidateSetName(pass));
            CandidateGeneration generation = context.getBackend().generateCandidates(request);
            context.commitExclusion(generation.nextExclusion());
            metrics.recordCandidates(pass.name(), generation.rowCount());
            log.info("pass.generated pass={} candidateSet={} rows={}",
                    pass.name(), generation.candidateSetName(), generation.rowCount());

            state = advance(state, PassState.STREAMING);
            Optional<CandidateSource> source = context.getBackend()
                    .openCandidates(generation.candidateSetName(), pass.chunkSize());
            if (source.isEmpty()) {
                log.warn("pass.skipped pass={} reason=no-candidate-set candidateSet={}",
                        pass.name(), generation.candidateSetName());
                return skipped(pass, state, generation.rowCount(), start, "no candidate set");
            }

            int chunks = 0;
            try (CandidateSource candidates = source.get()) {
                List<CandidatePair> pairs;
                while (!(pairs = candidates.nextChunk()).isEmpty()) {
                    sink.accept(new CandidateChunk(pass.name(), chunks, pairs));
                    chunks++;
                }
            }

            state = advance(state, PassState.EXHAUSTED);
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordPassDuration(pass.name(), duration);
            log.info("pass.completed pass={} rows={} chunks={} durationMs={}",
                    pass.name(), generation.rowCount(), chunks, duration.toMillis());
            return new PassReport(pass.name(), pass.kind(), state, generation.rowCount(), chunks, duration, "");
        }
    }

    private PassReport skipped(PassDefinition pass, PassState current, long rows, long start, String reason) {
        PassState state = advance(current, PassState.SKIPPED);
        metrics.incrementPassSkipped(pass.name());
        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        return new PassReport(pass.name(), pass.kind(), state, rows, 0, duration, reason);
    }

    private static PassState advance(PassState current, PassState next) {
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal pass transition " + current + " -> " + next);
        }
        return next;
    }
}
