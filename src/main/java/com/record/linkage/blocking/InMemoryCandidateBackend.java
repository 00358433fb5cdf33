package com.record.linkage.blocking;

import com.record.linkage.blocking.predicate.JoinPredicate;
import com.record.linkage.core.model.CandidatePair;
import com.record.linkage.core.model.RecordSet;
import com.record.linkage.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Candidate backend that blocks without a relational store.
 *
 * <p>Records with an empty value in any current blocking column are dropped, the
 * remaining side-B records are indexed by their blocking-value tuple, and side A is
 * probed against that index. Each joined pair is then tested against the pass's full
 * join predicate, which removes pairs that also agree on a prior pass's tuple and, in
 * dedup mode, self-pairs and mirrored pairs. Prior columns are read through the side
 * they belong to, so a name shared by the current and a prior key, or by both record
 * sets, never collides.</p>
 *
 * <p>Materialized candidate sets are held until opened; opening hands the set to the
 * returned source and forgets it.</p>
 */
public class InMemoryCandidateBackend implements CandidateBackend {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCandidateBackend.class);

    private static final Comparator<CandidatePair> STREAM_ORDER =
            Comparator.comparingLong(CandidatePair::ordinalA).thenComparingLong(CandidatePair::ordinalB);

    private final RecordSet recordsA;
    private final RecordSet recordsB;
    private final Map<String, List<CandidatePair>> candidateSets = new HashMap<>();

    /**
     * @param recordsA side A
     * @param recordsB side B; pass {@code recordsA} again for dedup
     */
    public InMemoryCandidateBackend(RecordSet recordsA, RecordSet recordsB) {
        this.recordsA = Objects.requireNonNull(recordsA, "recordsA is required");
        this.recordsB = Objects.requireNonNull(recordsB, "recordsB is required");
    }

    @Override
    public CandidateGeneration generateCandidates(CandidateRequest request) {
        BlockingKey key = request.key();
        JoinPredicate predicate = request.joinPredicate();

        Map<List<String>, List<SourceRecord>> index = new HashMap<>();
        for (SourceRecord b : recordsB.getRecords()) {
            List<String> values = keyValues(b, key.columnsB());
            if (values != null) {
                index.computeIfAbsent(values, k -> new ArrayList<>()).add(b);
            }
        }

        List<CandidatePair> pairs = new ArrayList<>();
        for (SourceRecord a : recordsA.getRecords()) {
            List<String> values = keyValues(a, key.columnsA());
            if (values == null) {
                continue;
            }
            List<SourceRecord> block = index.get(values);
            if (block == null) {
                continue;
            }
            for (SourceRecord b : block) {
                if (predicate.test(a, b)) {
                    pairs.add(CandidatePair.of(a, b));
                }
            }
        }
        pairs.sort(STREAM_ORDER);

        candidateSets.put(request.candidateSetName(), pairs);
        log.debug("candidates.materialized set={} blocks={} rows={}",
                request.candidateSetName(), index.size(), pairs.size());

        return new CandidateGeneration(request.candidateSetName(), pairs.size(),
                request.exclusion().combine(key));
    }

    @Override
    public Optional<CandidateSource> openCandidates(String candidateSetName, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        List<CandidatePair> pairs = candidateSets.remove(candidateSetName);
        if (pairs == null) {
            return Optional.empty();
        }
        return Optional.of(new ListCandidateSource(pairs, chunkSize));
    }

    @Override
    public String getName() {
        return "in-memory";
    }

    @Override
    public void close() {
        candidateSets.clear();
    }

    /**
     * Returns the record's values for the given columns, or {@code null} if any is empty.
     */
    private static List<String> keyValues(SourceRecord record, List<String> columns) {
        List<String> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            if (record.isEmpty(column)) {
                return null;
            }
            values.add(record.value(column));
        }
        return values;
    }

    private static final class ListCandidateSource implements CandidateSource {
        private final List<CandidatePair> pairs;
        private final int chunkSize;
        private int position;

        private ListCandidateSource(List<CandidatePair> pairs, int chunkSize) {
            this.pairs = pairs;
            this.chunkSize = chunkSize;
        }

        @Override
        public List<CandidatePair> nextChunk() {
            if (position >= pairs.size()) {
                return List.of();
            }
            int end = Math.min(position + chunkSize, pairs.size());
            List<CandidatePair> chunk = List.copyOf(pairs.subList(position, end));
            position = end;
            return chunk;
        }

        @Override
        public void close() {
            position = pairs.size();
        }
    }
}
