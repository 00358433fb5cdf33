package com.record.linkage.similarity;

/**
 * Normalized edit distance: {@code 1 - distance / max(length)}.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

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
        return 1.0 - (double) distance(left, right) / Math.max(left.length(), right.length());
    }

    @Override
    public String getName() {
        return "levenshtein";
    }

    /**
     * Two-row Wagner-Fischer over the shorter string.
     */
    static int distance(String left, String right) {
        String shorter = left.length() <= right.length() ? left : right;
        String longer = shorter == left ? right : left;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i < previous.length; i++) {
            previous[i] = i;
        }
        for (int row = 1; row <= longer.length(); row++) {
            current[0] = row;
            char c = longer.charAt(row - 1);
            for (int col = 1; col <= shorter.length(); col++) {
                int substitution = previous[col - 1] + (shorter.charAt(col - 1) == c ? 0 : 1);
                current[col] = Math.min(substitution, Math.min(previous[col], current[col - 1]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}
