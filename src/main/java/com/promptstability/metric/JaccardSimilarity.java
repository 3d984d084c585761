package com.promptstability.metric;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Word-overlap similarity: size of the intersection of the two lower-cased,
 * whitespace-separated word sets divided by the size of their union.
 */
public class JaccardSimilarity implements SimilarityMetric {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public double calculate(String first, String second) {
        Set<String> firstWords = words(Objects.requireNonNull(first, "first"));
        Set<String> secondWords = words(Objects.requireNonNull(second, "second"));

        if (firstWords.isEmpty() && secondWords.isEmpty()) {
            return 1.0;
        }

        Set<String> union = new HashSet<>(firstWords);
        union.addAll(secondWords);
        if (union.isEmpty()) {
            return 0.0;
        }
        long intersection = firstWords.stream().filter(secondWords::contains).count();
        return (double) intersection / union.size();
    }

    @Override
    public String name() {
        return "jaccard";
    }

    static Set<String> words(String text) {
        return Arrays.stream(WHITESPACE.split(text.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }
}
