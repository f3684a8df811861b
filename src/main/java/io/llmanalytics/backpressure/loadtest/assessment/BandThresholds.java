package io.llmanalytics.backpressure.loadtest.assessment;

import io.llmanalytics.backpressure.ConfigurationException;

/**
 * Two cut points splitting a metric into the three bands.
 *
 * For higher-is-better metrics a value at or above excellent is EXCELLENT and at or above good is
 * GOOD. For lower-is-better metrics a value strictly below excellent is EXCELLENT and strictly
 * below good is GOOD. Everything else needs improvement.
 */
public final class BandThresholds {
    private final double excellent;
    private final double good;
    private final boolean higherIsBetter;

    private BandThresholds(double excellent, double good, boolean higherIsBetter) {
        this.excellent = excellent;
        this.good = good;
        this.higherIsBetter = higherIsBetter;
    }

    public static BandThresholds higherIsBetter(double excellentAtLeast, double goodAtLeast) {
        if (excellentAtLeast < goodAtLeast)
            throw new ConfigurationException("excellent threshold " + excellentAtLeast
                + " is below good threshold " + goodAtLeast);
        return new BandThresholds(excellentAtLeast, goodAtLeast, true);
    }

    public static BandThresholds lowerIsBetter(double excellentBelow, double goodBelow) {
        if (excellentBelow > goodBelow)
            throw new ConfigurationException("excellent threshold " + excellentBelow
                + " is above good threshold " + goodBelow);
        return new BandThresholds(excellentBelow, goodBelow, false);
    }

    public Band classify(double value) {
        if (higherIsBetter) {
            if (value >= excellent)
                return Band.EXCELLENT;
            return value >= good ? Band.GOOD : Band.NEEDS_IMPROVEMENT;
        }
        if (value < excellent)
            return Band.EXCELLENT;
        return value < good ? Band.GOOD : Band.NEEDS_IMPROVEMENT;
    }

    @Override
    public String toString() {
        return (higherIsBetter ? ">=" : "<") + excellent + " excellent, "
            + (higherIsBetter ? ">=" : "<") + good + " good";
    }
}
