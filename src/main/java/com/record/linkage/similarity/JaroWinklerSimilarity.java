package com.record.linkage.similarity;

/**
 * Jaro-Winkler similarity: Jaro similarity boosted by the length of the common
 * prefix (at most four characters). Suited to names and short identifiers.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_PREFIX_SCALE = 0.1;
    private static final int PREFIX_LIMIT = 4;

    private final double prefixScale;

    public JaroWinklerSimilarity() {
        this(DEFAULT_PREFIX_SCALE);
    }

    public JaroWinklerSimilarity(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("prefixScale must be between 0 and 0.25");
        }
        this.prefixScale = prefixScale;
    }

    @Override
    public double compute(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        double jaro = jaro(left, right);
        return jaro + commonPrefix(left, right) * prefixScale * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return "jaro_winkler";
    }

    private static int commonPrefix(String left, String right) {
        int limit = Math.min(PREFIX_LIMIT, Math.min(left.length(), right.length()));
        int length = 0;
        while (length < limit && left.charAt(length) == right.charAt(length)) {
            length++;
        }
        return length;
    }

    static double jaro(String left, String right) {
        int window = Math.max(0, Math.max(left.length(), right.length()) / 2 - 1);
        boolean[] leftMatched = new boolean[left.length()];
        boolean[] rightMatched = new boolean[right.length()];

        int matches = 0;
        for (int i = 0; i < left.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(right.length(), i + window + 1);
            for (int j = from; j < to; j++) {
                if (!rightMatched[j] && left.charAt(i) == right.charAt(j)) {
                    leftMatched[i] = true;
                    rightMatched[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int outOfOrder = 0;
        int j = 0;
        for (int i = 0; i < left.length(); i++) {
            if (!leftMatched[i]) {
                continue;
            }
            while (!rightMatched[j]) {
                j++;
            }
            if (left.charAt(i) != right.charAt(j)) {
                outOfOrder++;
            }
            j++;
        }

        double m = matches;
        return (m / left.length() + m / right.length() + (m - outOfOrder / 2.0) / m) / 3.0;
    }
}
