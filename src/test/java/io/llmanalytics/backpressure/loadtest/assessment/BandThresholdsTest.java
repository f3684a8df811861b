package io.llmanalytics.backpressure.loadtest.assessment;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import io.llmanalytics.backpressure.ConfigurationException;

public class BandThresholdsTest {

    @Test
    public void higherIsBetterBoundariesAreInclusive() {
        BandThresholds t = BandThresholds.higherIsBetter(100, 50);

        assertEquals(Band.EXCELLENT, t.classify(100));
        assertEquals(Band.EXCELLENT, t.classify(1e9));
        assertEquals(Band.GOOD, t.classify(99.999));
        assertEquals(Band.GOOD, t.classify(50));
        assertEquals(Band.NEEDS_IMPROVEMENT, t.classify(49.999));
        assertEquals(Band.NEEDS_IMPROVEMENT, t.classify(0));
    }

    @Test
    public void lowerIsBetterBoundariesAreExclusive() {
        BandThresholds t = BandThresholds.lowerIsBetter(100, 200);

        assertEquals(Band.EXCELLENT, t.classify(0));
        assertEquals(Band.EXCELLENT, t.classify(99.9));
        assertEquals(Band.GOOD, t.classify(100));
        assertEquals(Band.GOOD, t.classify(199.9));
        assertEquals(Band.NEEDS_IMPROVEMENT, t.classify(200));
    }

    @Test
    public void rejectsInvertedThresholds() {
        assertThrows(ConfigurationException.class, () -> BandThresholds.higherIsBetter(10, 20));
        assertThrows(ConfigurationException.class, () -> BandThresholds.lowerIsBetter(20, 10));
    }

    @Test
    public void bandOrdering() {
        assertTrue(Band.EXCELLENT.isAtLeast(Band.GOOD));
        assertTrue(Band.GOOD.isAtLeast(Band.GOOD));
        assertFalse(Band.NEEDS_IMPROVEMENT.isAtLeast(Band.GOOD));
    }
}
