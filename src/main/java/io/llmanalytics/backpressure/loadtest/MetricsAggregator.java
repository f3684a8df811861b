package io.llmanalytics.backpressure.loadtest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reduces per-call results of one phase into a {@link LoadTestReport}.
 *
 * Throughput counts every attempted call, failed or not. Latency statistics use successful calls
 * only; percentiles are nearest-rank on the ascending sample (index ceil(p * n) - 1, clamped).
 */
public final class MetricsAggregator {
    public static final int P95_MIN_SAMPLES = 20;
    public static final int P99_MIN_SAMPLES = 100;

    private MetricsAggregator() {
    }

    public static LoadTestReport reduce(List<OperationResult> results, Duration totalTime) {
        return reduce("phase", results, totalTime, results.size(), 0);
    }

    public static LoadTestReport reduce(String phase, List<OperationResult> results, Duration totalTime,
            long plannedOps, int lostWorkers) {
        Objects.requireNonNull(results, "results");
        Objects.requireNonNull(totalTime, "totalTime");

        long[] latencies = new long[results.size()];
        int n = 0;
        long errors = 0;
        long positives = 0;
        long sum = 0;
        for (OperationResult r : results) {
            if (!r.isSucceeded()) {
                errors++;
                continue;
            }
            long nanos = r.elapsedNanos();
            latencies[n++] = nanos;
            sum += nanos;
            if (r.isPositive())
                positives++;
        }
        latencies = Arrays.copyOf(latencies, n);
        Arrays.sort(latencies);

        long totalNanos = totalTime.toNanos();
        double opsPerSecond = totalNanos <= 0 ? 0.0 : results.size() / (totalNanos / 1_000_000_000.0);

        Duration average = n == 0 ? null : Duration.ofNanos(Math.round((double) sum / n));
        Duration p95 = n < P95_MIN_SAMPLES ? null : Duration.ofNanos(nearestRank(latencies, 0.95));
        Duration p99 = n < P99_MIN_SAMPLES ? null : Duration.ofNanos(nearestRank(latencies, 0.99));

        return new LoadTestReport(phase, plannedOps, results.size(), totalTime, opsPerSecond,
            average, p95, p99, n, errors, positives, lostWorkers);
    }

    /**
     * Nearest-rank percentile of an ascending, non-empty sample.
     */
    static long nearestRank(long[] sorted, double percentile) {
        if (sorted.length == 0)
            throw new IllegalArgumentException("empty sample");
        // exact decimal product, so 0.95 * 20 is 19 and not 19.000000000000004
        int rank = BigDecimal.valueOf(percentile)
            .multiply(BigDecimal.valueOf(sorted.length))
            .setScale(0, RoundingMode.CEILING)
            .intValueExact();
        int index = Math.max(0, Math.min(sorted.length - 1, rank - 1));
        return sorted[index];
    }
}
