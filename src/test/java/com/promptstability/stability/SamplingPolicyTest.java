package com.promptstability.stability;

import org.junit.jupiter.api.Test;

import com.promptstability.runtime.InvalidConfigurationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SamplingPolicyTest {

    @Test
    void shouldHalvePopulationWithFloorOfTwo() {
        SamplingPolicy policy = SamplingPolicy.halved();

        assertEquals(2, policy.sampleSize(2));
        assertEquals(2, policy.sampleSize(3));
        assertEquals(2, policy.sampleSize(5));
        assertEquals(5, policy.sampleSize(10));
        assertEquals(5, policy.sampleSize(11));
    }

    @Test
    void shouldUseFixedSizeOrWholePopulation() {
        assertEquals(4, SamplingPolicy.fixed(4).sampleSize(10));
        assertEquals(7, SamplingPolicy.fullSet().sampleSize(7));
    }

    @Test
    void shouldParseModeNames() {
        assertEquals(SamplingPolicy.halved(), SamplingPolicy.of("HALVED", null));
        assertEquals(SamplingPolicy.fixed(3), SamplingPolicy.of("fixed", 3));
        assertEquals(SamplingPolicy.fullSet(), SamplingPolicy.of("fixed", null));
        assertThrows(InvalidConfigurationException.class, () -> SamplingPolicy.of("bootstrap", null));
    }

    @Test
    void shouldRejectNonPositiveFixedSize() {
        assertThrows(InvalidConfigurationException.class, () -> SamplingPolicy.fixed(0));
        assertThrows(InvalidConfigurationException.class, () -> new SamplingPolicy(SamplingPolicy.Mode.HALVED, 3));
    }
}
