package com.record.linkage.output;

import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.StrictnessTier;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * Running pair and match counts per pass and strictness tier.
 * Updated on the coordinator thread only.
 */
public class PassCounts {

    private final Map<String, Long> pairs = new LinkedHashMap<>();
    private final Map<String, EnumMap<StrictnessTier, Long>> matches = new LinkedHashMap<>();

    public void tally(MatchResult result) {
        pairs.merge(result.passName(), 1L, Long::sum);
        EnumMap<StrictnessTier, Long> byTier = matches.computeIfAbsent(result.passName(),
                k -> new EnumMap<>(StrictnessTier.class));
        for (StrictnessTier tier : result.tiers()) {
            byTier.merge(tier, 1L, Long::sum);
        }
    }

    public void tallyAll(Collection<MatchResult> results) {
        results.forEach(this::tally);
    }

    /**
     * Pass names in the order they were first seen.
     */
    public List<String> passNames() {
        return List.copyOf(pairs.keySet());
    }

    public long pairs(String passName) {
        return pairs.getOrDefault(passName, 0L);
    }

    public long total() {
        return pairs.values().stream().mapToLong(Long::longValue).sum();
    }

    public long matches(String passName, StrictnessTier tier) {
        EnumMap<StrictnessTier, Long> byTier = matches.get(passName);
        return byTier != null ? byTier.getOrDefault(tier, 0L) : 0L;
    }

    public long totalMatches(StrictnessTier tier) {
        return matches.values().stream()
                .mapToLong(byTier -> byTier.getOrDefault(tier, 0L))
                .sum();
    }

    /**
     * One line per pass plus a total line, e.g.
     * {@code 1: pairs=10 match_strict=4 match_moderate=5 match_relaxed=6 match_review=8}.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (String pass : pairs.keySet()) {
            appendLine(sb, pass, pairs(pass), tier -> matches(pass, tier));
        }
        appendLine(sb, "total", total(), this::totalMatches);
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String label, long pairCount,
                                   ToLongFunction<StrictnessTier> tierCount) {
        sb.append(label).append(": pairs=").append(pairCount);
        for (StrictnessTier tier : StrictnessTier.values()) {
            sb.append(' ').append(tier.getColumnName()).append('=').append(tierCount.applyAsLong(tier));
        }
        sb.append(System.lineSeparator());
    }

    @Override
    public String toString() {
        return "PassCounts{passes=" + pairs.size() + ", total=" + total() + '}';
    }
}
