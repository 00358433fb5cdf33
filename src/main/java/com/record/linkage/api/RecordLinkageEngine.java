package com.record.linkage.api;

import com.record.linkage.blocking.CandidateBackend;
import com.record.linkage.blocking.InMemoryCandidateBackend;
import com.record.linkage.blocking.MatchContext;
import com.record.linkage.blocking.PassOrchestrator;
import com.record.linkage.blocking.PassReport;
import com.record.linkage.blocking.RelationalCandidateBackend;
import com.record.linkage.core.model.RecordSet;
import com.record.linkage.dispatch.MatchDispatcher;
import com.record.linkage.logging.LogContext;
import com.record.linkage.metrics.MatchMetrics;
import com.record.linkage.metrics.NoOpMatchMetrics;
import com.record.linkage.output.ExponentialWeightScheme;
import com.record.linkage.output.OutputAssembler;
import com.record.linkage.output.PassCounts;
import com.record.linkage.output.ShardWriter;
import com.record.linkage.output.WeightScheme;
import com.record.linkage.relational.DataSourceFactory;
import com.record.linkage.relational.RecordTable;
import com.record.linkage.relational.RecordTableLoader;
import com.record.linkage.relational.RelationalSettings;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point: runs blocking, scoring and output for one pair of record sets.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * MatchOptions options = MatchOptions.builder()
 *     .matchType(MatchType.ONE_TO_ONE)
 *     .blockingPlan(BlockingPlan.builder().groundTruth("ssn").pass(1, "ssn").pass(2, "first_name", "dob").build())
 *     .comparerVariables("1", List.of("first_name", "last_name"))
 *     .outputDirectory(Path.of("out"))
 *     .build();
 *
 * try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
 *         .options(options)
 *         .comparer(FieldSimilarityComparer.builder().variablesByPass(options.getComparerVariablesByPass()).build())
 *         .build()) {
 *     MatchRunResult result = engine.run(recordsA, recordsB);
 * }
 * </pre>
 *
 * <p>With relational settings or a data source the record sets are staged as tables and
 * every pass is a server-side join; otherwise blocking runs in memory. Both produce the
 * same pairs.</p>
 */
public class RecordLinkageEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecordLinkageEngine.class);

    private final MatchOptions options;
    private final PairComparer comparer;
    private final DataSource dataSource;
    private final boolean ownsDataSource;
    private final MatchMetrics metrics;

    private RecordLinkageEngine(Builder builder) {
        this.options = builder.options;
        this.comparer = builder.comparer;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMatchMetrics();
        if (builder.dataSource != null) {
            this.dataSource = builder.dataSource;
            this.ownsDataSource = false;
        } else if (options.getRelationalSettings().isPresent()) {
            this.dataSource = DataSourceFactory.create(options.getRelationalSettings().get());
            this.ownsDataSource = true;
        } else {
            this.dataSource = null;
            this.ownsDataSource = false;
        }
    }

    public MatchOptions getOptions() {
        return options;
    }

    public boolean isRelational() {
        return dataSource != null;
    }

    /**
     * Runs every pass of the plan and writes the shards.
     *
     * @param recordsA side A
     * @param recordsB side B, ignored (may be null) when deduplicating
     */
    public MatchRunResult run(RecordSet recordsA, RecordSet recordsB) {
        boolean dedup = options.getMatchType().isDedup();
        if (recordsA == null || (!dedup && recordsB == null)) {
            throw new IllegalArgumentException("Record sets are required for match type " +
                    options.getMatchType().getCode());
        }
        RecordSet sideB = dedup ? recordsA : recordsB;
        WeightScheme weights = options.getWeightScheme()
                .orElseGet(() -> new ExponentialWeightScheme(options.getBlockingPlan()));
        String runId = LogContext.generateRunId();

        try (LogContext ignored = LogContext.forRun(runId)) {
            log.info("run.started matchType={} backend={} recordsA={} recordsB={} passes={} parallelism={}",
                    options.getMatchType().getCode(), isRelational() ? "relational" : "in-memory",
                    recordsA.size(), sideB.size(), options.getBlockingPlan().orderedPasses().size(),
                    options.getParallelism());

            List<RecordTable> staged = new ArrayList<>();
            RecordTableLoader loader = isRelational() ? newLoader() : null;
            try {
                CandidateBackend backend;
                if (loader != null) {
                    RecordTable tableA = loader.load(recordsA);
                    staged.add(tableA);
                    RecordTable tableB = tableA;
                    if (!dedup) {
                        tableB = loader.load(sideB);
                        staged.add(tableB);
                    }
                    backend = new RelationalCandidateBackend(dataSource, schema(), tableA, tableB);
                } else {
                    backend = new InMemoryCandidateBackend(recordsA, sideB);
                }
                return execute(runId, backend, weights, recordsA, sideB);
            } finally {
                for (RecordTable table : staged) {
                    loader.drop(table);
                }
            }
        }
    }

    private MatchRunResult execute(String runId, CandidateBackend candidateBackend, WeightScheme weights,
                                   RecordSet recordsA, RecordSet recordsB) {
        PassCounts counts = new PassCounts();
        ShardWriter writer = new ShardWriter(options.getOutputDirectory(), options.comparerColumns());

        try (CandidateBackend backend = candidateBackend;
             OutputAssembler assembler = new OutputAssembler(writer, weights, counts, metrics);
             MatchDispatcher dispatcher = new MatchDispatcher(comparer, recordsA, recordsB,
                     options.getDispatchPolicy(), assembler, metrics)) {

            MatchContext context = new MatchContext(runId, options.getMatchType(), recordsA, recordsB, backend);
            List<PassReport> reports = new PassOrchestrator(context, metrics)
                    .run(options.getBlockingPlan(), assembler.groundTruthSink(), dispatcher);
            dispatcher.flush();

            log.info("run.completed batches={} shards={} pairs={}{}{}",
                    dispatcher.getBatchesSubmitted(), assembler.getShards().size(), counts.total(),
                    System.lineSeparator(), counts.summary());
            return new MatchRunResult(runId, reports, counts, assembler.getShards(), context.getExclusion());
        }
    }

    private RecordTableLoader newLoader() {
        int batchSize = options.getRelationalSettings()
                .map(RelationalSettings::getInsertBatchSize)
                .orElse(RelationalSettings.DEFAULT_INSERT_BATCH_SIZE);
        return new RecordTableLoader(dataSource, schema(), batchSize);
    }

    private String schema() {
        return options.getRelationalSettings().map(RelationalSettings::getSchema).orElse(null);
    }

    @Override
    public void close() {
        if (ownsDataSource && dataSource instanceof HikariDataSource hikari) {
            hikari.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchOptions options;
        private PairComparer comparer;
        private DataSource dataSource;
        private MatchMetrics metrics;

        public Builder options(MatchOptions options) {
            this.options = options;
            return this;
        }

        public Builder comparer(PairComparer comparer) {
            this.comparer = comparer;
            return this;
        }

        /**
         * Uses an existing data source for relational blocking. The caller keeps ownership.
         */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder metrics(MatchMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public RecordLinkageEngine build() {
            if (options == null) {
                throw new IllegalArgumentException("options are required");
            }
            if (comparer == null) {
                throw new IllegalArgumentException("comparer is required");
            }
            return new RecordLinkageEngine(this);
        }
    }
}
