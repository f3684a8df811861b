package io.llmanalytics.backpressure.loadtest;

import java.time.Duration;
import java.util.Optional;

/**
 * Timing of a single operation call. Failed calls carry no elapsed time so they can never
 * pull latency statistics down.
 */
public final class OperationResult {
    private static final long NO_ELAPSED = -1L;
    private static final OperationResult FAILED = new OperationResult(false, NO_ELAPSED, false);

    private final boolean succeeded;
    private final long elapsedNanos;
    private final boolean positive;

    private OperationResult(boolean succeeded, long elapsedNanos, boolean positive) {
        this.succeeded = succeeded;
        this.elapsedNanos = elapsedNanos;
        this.positive = positive;
    }

    public static OperationResult succeeded(long elapsedNanos, boolean positive) {
        if (elapsedNanos < 0)
            throw new IllegalArgumentException("elapsedNanos < 0");
        return new OperationResult(true, elapsedNanos, positive);
    }

    public static OperationResult succeeded(Duration elapsed) {
        return succeeded(elapsed.toNanos(), true);
    }

    public static OperationResult failed() {
        return FAILED;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public Optional<Duration> getElapsed() {
        return succeeded ? Optional.of(Duration.ofNanos(elapsedNanos)) : Optional.empty();
    }

    /**
     * Elapsed nanoseconds of a successful call.
     *
     * @throws IllegalStateException for a failed call
     */
    public long elapsedNanos() {
        if (!succeeded)
            throw new IllegalStateException("failed call has no elapsed time");
        return elapsedNanos;
    }

    /**
     * Hit / admitted. Always false for a failed call.
     */
    public boolean isPositive() {
        return positive;
    }

    @Override
    public String toString() {
        return succeeded
            ? "OperationResult{succeeded, elapsed=" + Duration.ofNanos(elapsedNanos) + ", positive=" + positive + "}"
            : "OperationResult{failed}";
    }
}
