package com.promptstability.stability;

import java.util.Locale;
import java.util.Objects;

import com.promptstability.runtime.InvalidConfigurationException;

/**
 * How many responses a single Monte-Carlo trial draws from a group.
 *
 * <p>{@link Mode#HALVED} draws {@code max(2, n / 2)} responses and is used for dispersion
 * estimation. {@link Mode#FIXED} draws a caller-chosen number of responses, or the whole
 * group when no size is given. Sizes larger than the group are clamped by the sampler.
 */
public record SamplingPolicy(Mode mode, Integer fixedSize) {

    public SamplingPolicy {
        Objects.requireNonNull(mode, "mode");
        if (mode == Mode.HALVED && fixedSize != null) {
            throw new InvalidConfigurationException("Halved sampling does not take a fixed sample size");
        }
        if (fixedSize != null && fixedSize <= 0) {
            throw new InvalidConfigurationException("Sample size must be positive: " + fixedSize);
        }
    }

    public static SamplingPolicy halved() {
        return new SamplingPolicy(Mode.HALVED, null);
    }

    public static SamplingPolicy fixed(int sampleSize) {
        return new SamplingPolicy(Mode.FIXED, sampleSize);
    }

    public static SamplingPolicy fullSet() {
        return new SamplingPolicy(Mode.FIXED, null);
    }

    public static SamplingPolicy of(String mode, Integer sampleSize) {
        String normalized = mode == null ? "halved" : mode.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "halved" -> halved();
            case "fixed" -> sampleSize == null ? fullSet() : fixed(sampleSize);
            default -> throw new InvalidConfigurationException("Unknown sampling mode: " + mode + " (supported: halved, fixed)");
        };
    }

    /**
     * Requested sample size for a group of {@code population} responses, before clamping.
     */
    public int sampleSize(int population) {
        if (mode == Mode.HALVED) {
            return Math.max(2, population / 2);
        }
        return fixedSize == null ? population : fixedSize;
    }

    public enum Mode {
        HALVED,
        FIXED
    }
}
