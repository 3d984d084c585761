package com.promptstability.metric;

import java.util.Objects;

/**
 * One minus the Levenshtein distance of the two texts, normalised by the longer length.
 */
public class EditDistanceSimilarity implements SimilarityMetric {

    @Override
    public double calculate(String first, String second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");

        int max = Math.max(first.length(), second.length());
        if (max == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(first, second) / max;
    }

    @Override
    public String name() {
        return "edit-distance";
    }

    static int levenshtein(String first, String second) {
        int[] previous = new int[second.length() + 1];
        int[] current = new int[second.length() + 1];
        for (int j = 0; j <= second.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= first.length(); i++) {
            current[0] = i;
            char c = first.charAt(i - 1);
            for (int j = 1; j <= second.length(); j++) {
                int substitution = previous[j - 1] + (c == second.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[second.length()];
    }
}
