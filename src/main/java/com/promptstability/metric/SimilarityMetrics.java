package com.promptstability.metric;

import java.util.List;
import java.util.Locale;

import com.promptstability.runtime.InvalidConfigurationException;

public final class SimilarityMetrics {
    public static final List<String> SUPPORTED_NAMES = List.of("jaccard", "length", "edit-distance", "cosine");

    private SimilarityMetrics() {
    }

    public static SimilarityMetric byName(String name) {
        if (name == null || name.isBlank()) {
            return new JaccardSimilarity();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "jaccard", "word-overlap" -> new JaccardSimilarity();
            case "length", "length-ratio" -> new LengthSimilarity();
            case "edit-distance", "levenshtein" -> new EditDistanceSimilarity();
            case "cosine", "hashing-cosine" -> new HashingCosineSimilarity();
            default -> throw new InvalidConfigurationException(
                    "Unknown similarity metric: " + name + " (supported: " + String.join(", ", SUPPORTED_NAMES) + ")");
        };
    }
}
