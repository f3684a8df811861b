package io.llmanalytics.backpressure.loadtest.assessment;

/**
 * Qualitative rating of a measured figure, best first.
 */
public enum Band {
    EXCELLENT,
    GOOD,
    NEEDS_IMPROVEMENT;

    public boolean isAtLeast(Band other) {
        return ordinal() <= other.ordinal();
    }
}
