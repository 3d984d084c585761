package com.promptstability.metric;

import java.util.Objects;

public class LengthSimilarity implements SimilarityMetric {

    @Override
    public double calculate(String first, String second) {
        int firstLength = Objects.requireNonNull(first, "first").length();
        int secondLength = Objects.requireNonNull(second, "second").length();

        if (firstLength == 0 && secondLength == 0) {
            return 1.0;
        }
        int max = Math.max(firstLength, secondLength);
        int min = Math.min(firstLength, secondLength);
        return max > 0 ? (double) min / max : 0.0;
    }

    @Override
    public String name() {
        return "length";
    }
}
