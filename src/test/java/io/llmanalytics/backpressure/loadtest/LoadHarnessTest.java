package io.llmanalytics.backpressure.loadtest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import io.llmanalytics.backpressure.ConfigurationException;
import io.llmanalytics.backpressure.limiter.metrics.MetricNames;
import io.llmanalytics.backpressure.limiter.metrics.MetricPublisher;
import io.llmanalytics.backpressure.limiter.reliability.RetryPolicy;

public class LoadHarnessTest {

    private final LoadHarness harness = LoadHarness.newBuilder().build();

    @Test
    public void remainderIsTruncated() {
        AtomicInteger calls = new AtomicInteger();

        LoadTestReport report = harness.runPhase("SET", 105, 10, w -> () -> {
            calls.incrementAndGet();
            return true;
        });

        assertEquals(100, calls.get());
        assertEquals(100, report.getTotalOps());
        assertEquals(100, report.getPlannedOps());
        assertEquals(0, report.getErrorCount());
        assertEquals(0, report.getLostWorkers());
    }

    @Test
    public void fewerOpsThanWorkersRunsNothing() {
        AtomicInteger calls = new AtomicInteger();

        LoadTestReport report = harness.runPhase("SET", 9, 10, w -> () -> calls.incrementAndGet() > 0);

        assertEquals(0, calls.get());
        assertEquals(0, report.getTotalOps());
        assertTrue(report.getAverageLatency().isEmpty());
    }

    @Test
    public void workersRunConcurrently() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        CountDownLatch allStarted = new CountDownLatch(4);

        LoadTestReport report = harness.runPhase("GET", 8, 4, w -> {
            allStarted.countDown();
            return () -> {
                // only returns once every worker is running, so sequential execution would hang
                allStarted.await();
                threads.add(Thread.currentThread().getName());
                return true;
            };
        });

        assertEquals(8, report.getSuccessCount());
        assertEquals(4, threads.size());
        assertTrue(threads.stream().allMatch(n -> n.startsWith("load-get-worker-")), threads.toString());
    }

    @Test
    public void threadNamesIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Set<String> threads = ConcurrentHashMap.newKeySet();

            harness.runPhase("RATE_LIMIT", 2, 2, w -> () -> threads.add(Thread.currentThread().getName()));

            assertTrue(threads.stream().allMatch(n -> n.startsWith("load-rate_limit-worker-")), threads.toString());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    public void latencyAndThroughputAreMeasured() {
        LoadTestReport report = harness.runPhase("SLEEP", 40, 4, w -> () -> {
            Thread.sleep(2);
            return true;
        });

        assertTrue(report.getAverageLatency().orElseThrow().toNanos() >= 2_000_000L);
        assertTrue(report.getP95Latency().isPresent());
        assertTrue(report.getP99Latency().isEmpty());
        double expected = report.getTotalOps() / (report.getTotalTime().toNanos() / 1e9);
        assertEquals(expected, report.getOpsPerSecond(), 1e-6);
        // 10 sequential 2 ms calls per worker
        assertTrue(report.getTotalTime().toMillis() >= 20);
    }

    @Test
    public void callFailuresAreErrorsNotLostWorkers() {
        AtomicInteger calls = new AtomicInteger();

        LoadTestReport report = harness.runPhase("MIXED", 100, 5, w -> () -> {
            if (calls.incrementAndGet() % 4 == 0)
                throw new IOException("timeout");
            return true;
        });

        assertEquals(100, report.getTotalOps());
        assertEquals(25, report.getErrorCount());
        assertEquals(75, report.getSuccessCount());
        assertEquals(0, report.getLostWorkers());
    }

    @Test
    public void failedSetupLosesOnlyThatWorker() {
        LoadTestReport report = harness.runPhase("SET", 100, 10, w -> {
            if (w == 3)
                throw new IOException("no connection for worker 3");
            return () -> true;
        });

        assertEquals(1, report.getLostWorkers());
        assertEquals(90, report.getTotalOps());
        assertEquals(100, report.getPlannedOps());
        assertEquals(0, report.getErrorCount());
    }

    @Test
    public void setupIsRetried() {
        ConcurrentHashMap<Integer, AtomicInteger> attempts = new ConcurrentHashMap<>();
        LoadHarness retrying = LoadHarness.newBuilder()
            .setupRetryPolicy(RetryPolicy.of(3, Duration.ZERO))
            .build();

        LoadTestReport report = retrying.runPhase("SET", 20, 4, w -> {
            if (attempts.computeIfAbsent(w, k -> new AtomicInteger()).incrementAndGet() < 3)
                throw new IOException("pool busy");
            return () -> true;
        });

        assertEquals(0, report.getLostWorkers());
        assertEquals(20, report.getSuccessCount());
        attempts.values().forEach(a -> assertEquals(3, a.get()));
    }

    @Test
    public void setupGivesUpAfterRetries() {
        AtomicInteger attempts = new AtomicInteger();
        LoadHarness retrying = LoadHarness.newBuilder()
            .setupRetryPolicy(RetryPolicy.of(2, Duration.ZERO))
            .build();

        LoadTestReport report = retrying.runPhase("SET", 10, 1, w -> {
            attempts.incrementAndGet();
            throw new IOException("pool busy");
        });

        assertEquals(2, attempts.get());
        assertEquals(1, report.getLostWorkers());
        assertEquals(0, report.getTotalOps());
    }

    @Test
    public void timedOutWorkerIsLost() {
        CountDownLatch never = new CountDownLatch(1);
        LoadHarness bounded = LoadHarness.newBuilder().phaseTimeout(Duration.ofMillis(500)).build();

        LoadTestReport report = bounded.runPhase("GET", 40, 4, w -> () -> {
            if (w == 0)
                never.await();
            return true;
        });

        assertEquals(1, report.getLostWorkers());
        assertEquals(30, report.getTotalOps());
        assertEquals(30, report.getSuccessCount());
    }

    @Test
    public void zeroOps() {
        LoadTestReport report = harness.runPhase("EMPTY", 0, 3, w -> () -> true);

        assertEquals(0, report.getTotalOps());
        assertEquals(0, report.getErrorCount());
        assertEquals(0, report.getLostWorkers());
    }

    @Test
    public void publishesPhaseMetrics() {
        MetricPublisher publisher = mock(MetricPublisher.class);
        LoadHarness metered = LoadHarness.newBuilder().metricPublisher(publisher).build();
        AtomicInteger calls = new AtomicInteger();

        metered.runPhase("SET", 20, 2, w -> {
            if (w == 1)
                throw new IOException("down");
            return () -> {
                if (calls.incrementAndGet() == 1)
                    throw new IOException("first call fails");
                return true;
            };
        });

        verify(publisher).incrementCounter(MetricNames.COMPLETED_OPERATIONS, 9);
        verify(publisher).incrementCounter(MetricNames.FAILED_OPERATIONS, 1);
        verify(publisher).incrementCounter(MetricNames.LOST_WORKERS, 1);
        verify(publisher).flush();
    }

    @Test
    public void rejectsBadArguments() {
        assertThrows(ConfigurationException.class, () -> harness.runPhase("X", 10, 0, w -> () -> true));
        assertThrows(ConfigurationException.class, () -> harness.runPhase("X", -1, 1, w -> () -> true));
        assertThrows(ConfigurationException.class, () -> harness.runPhase("X", 10, 1, null));
        assertThrows(ConfigurationException.class, () -> harness.runPhase(null, 10, 1, w -> () -> true));
        assertThrows(ConfigurationException.class,
            () -> LoadHarness.newBuilder().phaseTimeout(Duration.ZERO));
    }
}
