package com.promptstability.metric;

/**
 * Compares two response texts.
 *
 * <p>Implementations return a value in {@code [0, 1]}, are symmetric in their arguments,
 * return exactly {@code 1.0} for identical texts and are defined for empty strings.
 * {@code null} arguments are rejected with a {@link NullPointerException}.
 */
public interface SimilarityMetric {
    double calculate(String first, String second);

    default String name() {
        return getClass().getSimpleName();
    }
}
