package io.llmanalytics.backpressure.limiter.reliability;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Retry policy configuration and helper: a fixed number of attempts with a fixed backoff.
 */
public class RetryPolicy {
    private final int maxAttempts;
    private final Duration backoff;

    public RetryPolicy(int maxAttempts, Duration backoff) {
        if (maxAttempts <= 0)
            throw new IllegalArgumentException("maxAttempts must be > 0");
        this.maxAttempts = maxAttempts;
        this.backoff = backoff == null ? Duration.ZERO : backoff;
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBackoff() { return backoff; }

    public static RetryPolicy of(int attempts, Duration backoff) { return new RetryPolicy(attempts, backoff); }

    public static RetryPolicy noRetry() { return new RetryPolicy(1, Duration.ZERO); }

    /**
     * Calls action until it succeeds or maxAttempts is used up, sleeping backoff between attempts.
     * The last failure is rethrown. Interruption during backoff stops retrying immediately.
     */
    public <T> T execute(Callable<T> action) throws Exception {
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return action.call();
            } catch (Exception ex) {
                if (attempts >= maxAttempts)
                    throw ex;
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    ex.addSuppressed(ie);
                    throw ex;
                }
            }
        }
    }
}
