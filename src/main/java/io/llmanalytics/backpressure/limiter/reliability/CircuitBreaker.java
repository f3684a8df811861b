package io.llmanalytics.backpressure.limiter.reliability;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts consecutive store failures and opens for openDuration once failureThreshold is reached.
 * While open, callers skip the store entirely. The first request after openDuration goes through
 * again; its outcome decides whether the count restarts from zero or keeps growing.
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final int failureThreshold;
    private final Duration openDuration;
    private final Clock clock;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong openUntilMillis = new AtomicLong(0);

    public CircuitBreaker(int failureThreshold, Duration openDuration) {
        this(failureThreshold, openDuration, Clock.systemUTC());
    }

    public CircuitBreaker(int failureThreshold, Duration openDuration, Clock clock) {
        if (failureThreshold <= 0)
            throw new IllegalArgumentException("failureThreshold must be > 0");
        Objects.requireNonNull(openDuration, "openDuration");
        if (openDuration.isNegative())
            throw new IllegalArgumentException("openDuration must be >= 0");
        this.failureThreshold = failureThreshold;
        this.openDuration = openDuration;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean allowRequest() {
        return clock.millis() >= openUntilMillis.get();
    }

    public boolean isOpen() {
        return !allowRequest();
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
    }

    public void recordFailure() {
        if (consecutiveFailures.incrementAndGet() >= failureThreshold) {
            openUntilMillis.set(clock.millis() + openDuration.toMillis());
            consecutiveFailures.set(0);
            logger.warn("Circuit opened after {} consecutive store failures, retrying in {} ms",
                failureThreshold, openDuration.toMillis());
        }
    }
}
