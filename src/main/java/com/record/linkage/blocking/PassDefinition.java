package com.record.linkage.blocking;

import com.record.linkage.relational.SqlIdentifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One unit of the blocking plan: the logical variables it blocks on, the chunk size its
 * candidates are streamed in, and whether side B's variable order is reversed.
 *
 * <p>Numbered passes are keyed by the configuration key (for example {@code "2"} or
 * {@code "pass2"}); the digits of the key give the pass number. A variable carrying the
 * {@value #INVERTED_SUFFIX} suffix marks the pass as inverted, e.g.
 * {@code [first_name, last_name_inv]} blocks A(first, last) against B(last, first).</p>
 */
public final class PassDefinition {

    public static final String INVERTED_SUFFIX = "_inv";
    public static final String GROUND_TRUTH_PREFIX = "dup_";

    private final String name;
    private final int number;
    private final PassKind kind;
    private final List<String> variables;
    private final int chunkSize;
    private final boolean inverted;

    private PassDefinition(String name, int number, PassKind kind, List<String> variables,
                           int chunkSize, boolean inverted) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.name = name;
        this.number = number;
        this.kind = kind;
        this.variables = List.copyOf(variables);
        this.chunkSize = chunkSize;
        this.inverted = inverted;
    }

    /**
     * Creates a ground-truth pass on a single identifier field. Its name is
     * {@code dup_<field>}.
     */
    public static PassDefinition groundTruth(String identifierField, int chunkSize) {
        if (identifierField == null || identifierField.isBlank()) {
            throw new IllegalArgumentException("Ground-truth field must not be null or blank");
        }
        return new PassDefinition(GROUND_TRUTH_PREFIX + identifierField, 0, PassKind.GROUND_TRUTH,
                List.of(identifierField), chunkSize, false);
    }

    /**
     * Creates a numbered pass from its configuration key and raw variable list.
     * An empty variable list yields a pass that is skipped at run time.
     *
     * @throws IllegalArgumentException if the key contains no digits
     */
    public static PassDefinition numbered(String key, List<String> rawVariables, int chunkSize) {
        Objects.requireNonNull(key, "key is required");
        String digits = key.replaceAll("\\D+", "");
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("Pass key must contain a pass number: '" + key + "'");
        }
        List<String> raw = rawVariables != null ? rawVariables : List.of();
        boolean inverted = raw.stream().anyMatch(v -> v.contains(INVERTED_SUFFIX));
        List<String> variables = new ArrayList<>(raw.size());
        for (String variable : raw) {
            variables.add(inverted ? variable.replace(INVERTED_SUFFIX, "") : variable);
        }
        return new PassDefinition(key, Integer.parseInt(digits), PassKind.NUMBERED, variables,
                chunkSize, inverted);
    }

    public String name() {
        return name;
    }

    public int number() {
        return number;
    }

    public PassKind kind() {
        return kind;
    }

    public boolean isGroundTruth() {
        return kind == PassKind.GROUND_TRUTH;
    }

    public List<String> variables() {
        return variables;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public boolean isInverted() {
        return inverted;
    }

    /**
     * Name of the pass-scoped candidate set: {@code candidates_<match>_p<number>} for
     * numbered passes and {@code candidates_<match>_matching_<field>} for ground truth,
     * shortened with a hash suffix when it exceeds the identifier length limit.
     */
    public String candidateSetName(String matchName) {
        String suffix = isGroundTruth() ? "_matching_" + variables.get(0) : "_p" + number;
        return SqlIdentifiers.tableName("candidates_", matchName + suffix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PassDefinition that)) return false;
        return number == that.number && chunkSize == that.chunkSize && inverted == that.inverted
                && name.equals(that.name) && kind == that.kind && variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, number, kind, variables, chunkSize, inverted);
    }

    @Override
    public String toString() {
        return "PassDefinition{name='" + name + "', kind=" + kind + ", variables=" + variables +
                ", chunkSize=" + chunkSize + ", inverted=" + inverted + '}';
    }
}
