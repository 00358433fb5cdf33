package com.record.linkage.blocking;

import com.record.linkage.blocking.predicate.JoinPredicate;
import com.record.linkage.blocking.predicate.Predicates;

import java.util.ArrayList;
import java.util.List;

/**
 * Cumulative record of everything already blocked on during a run.
 *
 * <p>An immutable, versioned value: the initial state excludes nothing and each
 * {@link #combine(BlockingKey)} returns the next version with one more prior key.
 * The relational backend renders {@link #asPredicate()} into SQL; the in-memory
 * backend evaluates it, or reads the parallel prior-column lists directly.</p>
 */
public final class ExclusionState {

    private static final ExclusionState INITIAL = new ExclusionState(0, List.of());

    private final int version;
    private final List<BlockingKey> priorKeys;

    private ExclusionState(int version, List<BlockingKey> priorKeys) {
        this.version = version;
        this.priorKeys = List.copyOf(priorKeys);
    }

    public static ExclusionState initial() {
        return INITIAL;
    }

    /**
     * Returns a new state that additionally excludes pairs satisfying {@code key}.
     */
    public ExclusionState combine(BlockingKey key) {
        List<BlockingKey> next = new ArrayList<>(priorKeys.size() + 1);
        next.addAll(priorKeys);
        next.add(key);
        return new ExclusionState(version + 1, next);
    }

    public int version() {
        return version;
    }

    public boolean isEmpty() {
        return priorKeys.isEmpty();
    }

    public List<BlockingKey> priorKeys() {
        return priorKeys;
    }

    /**
     * Previously used blocking tuples of side A, parallel to {@link #priorColumnsB()}.
     */
    public List<List<String>> priorColumnsA() {
        return priorKeys.stream().map(BlockingKey::columnsA).toList();
    }

    public List<List<String>> priorColumnsB() {
        return priorKeys.stream().map(BlockingKey::columnsB).toList();
    }

    /**
     * OR of every prior key's equality predicate. The initial state renders an
     * always-false disjunction.
     */
    public JoinPredicate asPredicate() {
        return Predicates.or(priorKeys.stream().map(BlockingKey::predicate).toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExclusionState that)) return false;
        return version == that.version && priorKeys.equals(that.priorKeys);
    }

    @Override
    public int hashCode() {
        return 31 * version + priorKeys.hashCode();
    }

    @Override
    public String toString() {
        return "ExclusionState{version=" + version + ", priorKeys=" + priorKeys + '}';
    }
}
