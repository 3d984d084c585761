package com.promptstability.stability;

/**
 * Distribution summary of the Monte-Carlo trial scores of one (prompt, agent) group.
 *
 * @param meanStability arithmetic mean of the trial scores
 * @param variance      population variance of the trial scores
 * @param stdDev        population standard deviation of the trial scores
 * @param minStability  lowest trial score
 * @param maxStability  highest trial score
 */
public record StabilityMetrics(
        double meanStability,
        double variance,
        double stdDev,
        double minStability,
        double maxStability) {

    private static final StabilityMetrics DEGENERATE = new StabilityMetrics(1.0, 0.0, 0.0, 1.0, 1.0);

    /**
     * Fixed metric for groups with fewer than two responses.
     */
    public static StabilityMetrics degenerate() {
        return DEGENERATE;
    }

    public static StabilityMetrics fromScores(double[] scores) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("At least one trial score is required");
        }

        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double score : scores) {
            sum += score;
            min = Math.min(min, score);
            max = Math.max(max, score);
        }
        // rounding in the sum can push the mean just outside [min, max]
        double mean = Math.min(max, Math.max(min, sum / scores.length));

        double squaredDeviations = 0.0;
        for (double score : scores) {
            double deviation = score - mean;
            squaredDeviations += deviation * deviation;
        }
        double variance = squaredDeviations / scores.length;
        return new StabilityMetrics(mean, variance, Math.sqrt(variance), min, max);
    }
}
