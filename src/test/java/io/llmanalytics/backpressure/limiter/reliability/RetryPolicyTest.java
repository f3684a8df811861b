package io.llmanalytics.backpressure.limiter.reliability;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class RetryPolicyTest {

    @Test
    public void retrySucceedsOnTransientFailure() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String result = RetryPolicy.of(3, Duration.ofMillis(1)).execute(() -> {
            if (calls.incrementAndGet() < 3)
                throw new IOException("transient");
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    public void givesUpAfterMaxAttemptsWithLastFailure() {
        AtomicInteger calls = new AtomicInteger();
        IOException ex = assertThrows(IOException.class, () -> RetryPolicy.of(2, Duration.ZERO).execute(() -> {
            throw new IOException("attempt " + calls.incrementAndGet());
        }));

        assertEquals("attempt 2", ex.getMessage());
        assertEquals(2, calls.get());
    }

    @Test
    public void noRetryCallsOnce() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(IllegalStateException.class, () -> RetryPolicy.noRetry().execute(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    public void rejectsNonPositiveAttempts() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(0, Duration.ZERO));
    }
}
