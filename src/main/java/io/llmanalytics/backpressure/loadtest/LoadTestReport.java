package io.llmanalytics.backpressure.loadtest;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Aggregate of one load phase. Immutable; produced by {@link MetricsAggregator}.
 *
 * Latency figures cover successful calls only. A percentile without enough samples is empty,
 * which is not the same as a measured zero.
 */
public final class LoadTestReport {
    private final String phase;
    private final long plannedOps;
    private final long totalOps;
    private final Duration totalTime;
    private final double opsPerSecond;
    private final Duration averageLatency;
    private final Duration p95Latency;
    private final Duration p99Latency;
    private final long successCount;
    private final long errorCount;
    private final long positiveOutcomes;
    private final int lostWorkers;

    LoadTestReport(String phase, long plannedOps, long totalOps, Duration totalTime, double opsPerSecond,
            Duration averageLatency, Duration p95Latency, Duration p99Latency, long successCount,
            long errorCount, long positiveOutcomes, int lostWorkers) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.plannedOps = plannedOps;
        this.totalOps = totalOps;
        this.totalTime = Objects.requireNonNull(totalTime, "totalTime");
        this.opsPerSecond = opsPerSecond;
        this.averageLatency = averageLatency;
        this.p95Latency = p95Latency;
        this.p99Latency = p99Latency;
        this.successCount = successCount;
        this.errorCount = errorCount;
        this.positiveOutcomes = positiveOutcomes;
        this.lostWorkers = lostWorkers;
    }

    public String getPhase() { return phase; }

    /**
     * Operations the phase set out to run after truncation to a multiple of the worker count.
     */
    public long getPlannedOps() { return plannedOps; }

    /**
     * Operations actually attempted; lost workers contribute nothing.
     */
    public long getTotalOps() { return totalOps; }

    public Duration getTotalTime() { return totalTime; }

    public double getOpsPerSecond() { return opsPerSecond; }

    public Optional<Duration> getAverageLatency() { return Optional.ofNullable(averageLatency); }

    public Optional<Duration> getP95Latency() { return Optional.ofNullable(p95Latency); }

    public Optional<Duration> getP99Latency() { return Optional.ofNullable(p99Latency); }

    public long getSuccessCount() { return successCount; }

    /**
     * Failed calls. Lost workers are not included, see {@link #getLostWorkers()}.
     */
    public long getErrorCount() { return errorCount; }

    public long getPositiveOutcomes() { return positiveOutcomes; }

    public int getLostWorkers() { return lostWorkers; }

    /**
     * Hits (or admissions) over successful calls. Empty when nothing succeeded.
     */
    public OptionalDouble getOutcomeRatio() {
        return successCount == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) positiveOutcomes / successCount);
    }

    @Override
    public String toString() {
        return "LoadTestReport{phase=" + phase
            + ", totalOps=" + totalOps
            + ", totalTime=" + totalTime
            + ", opsPerSecond=" + opsPerSecond
            + ", averageLatency=" + averageLatency
            + ", p95Latency=" + p95Latency
            + ", p99Latency=" + p99Latency
            + ", errorCount=" + errorCount
            + ", lostWorkers=" + lostWorkers + "}";
    }
}
