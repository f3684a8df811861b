package io.llmanalytics.backpressure.limiter.reliability;

import io.llmanalytics.backpressure.store.BackingStoreException;

/**
 * The store was not called because the circuit breaker is open.
 */
public class CircuitOpenException extends BackingStoreException {

    public CircuitOpenException() {
        super("circuit breaker open, store call skipped");
    }
}
