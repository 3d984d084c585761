package com.promptstability.metric;

import java.util.Locale;
import java.util.Objects;

/**
 * Cosine similarity of hashed bag-of-words vectors. Tokens are folded into a fixed number
 * of buckets, so unrelated words may collide; the result is still bounded and symmetric.
 */
public class HashingCosineSimilarity implements SimilarityMetric {
    public static final int DEFAULT_DIMENSION = 384;

    private final int dimension;

    public HashingCosineSimilarity() {
        this(DEFAULT_DIMENSION);
    }

    public HashingCosineSimilarity(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public double calculate(String first, String second) {
        long[] firstVector = embed(Objects.requireNonNull(first, "first"));
        long[] secondVector = embed(Objects.requireNonNull(second, "second"));

        long dot = 0L;
        long firstNorm = 0L;
        long secondNorm = 0L;
        for (int i = 0; i < dimension; i++) {
            dot += firstVector[i] * secondVector[i];
            firstNorm += firstVector[i] * firstVector[i];
            secondNorm += secondVector[i] * secondVector[i];
        }

        if (firstNorm == 0L && secondNorm == 0L) {
            return 1.0;
        }
        if (firstNorm == 0L || secondNorm == 0L) {
            return 0.0;
        }
        // integer norms keep sqrt(n * n) exact, so identical texts score exactly 1.0
        double cosine = dot / Math.sqrt((double) firstNorm * (double) secondNorm);
        return Math.min(1.0, Math.max(0.0, cosine));
    }

    @Override
    public String name() {
        return "cosine";
    }

    long[] embed(String text) {
        long[] vector = new long[dimension];
        if (text.isBlank()) {
            return vector;
        }

        String[] tokens = text.toLowerCase(Locale.ROOT).split("\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            int index = Math.floorMod(token.hashCode(), dimension);
            vector[index] += 1L;
        }
        return vector;
    }
}
