package io.llmanalytics.backpressure.loadtest.assessment;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

import io.llmanalytics.backpressure.ConfigurationException;
import io.llmanalytics.backpressure.loadtest.LoadTestReport;

/**
 * Maps measured figures to bands. Pure and stateless apart from its thresholds, which are
 * supplied by name through the builder.
 *
 * Defaults: throughput >= 100k ops/s excellent, >= 50k good; hit and admit ratios >= 0.90
 * excellent, >= 0.70 good; p95 latency < 100 ms excellent, < 200 ms good; concurrency (connections
 * held at once) >= 1000 excellent, >= 500 good.
 */
public final class AssessmentPolicy {

    /**
     * What a phase's positive outcomes mean, and so which ratio thresholds apply.
     */
    public enum OutcomeKind {
        HIT,
        ADMIT,
        NONE
    }

    private final BandThresholds throughput;
    private final BandThresholds hitRatio;
    private final BandThresholds admitRatio;
    private final BandThresholds p95LatencyMillis;
    private final BandThresholds concurrency;

    private AssessmentPolicy(Builder builder) {
        this.throughput = builder.throughput;
        this.hitRatio = builder.hitRatio;
        this.admitRatio = builder.admitRatio;
        this.p95LatencyMillis = builder.p95LatencyMillis;
        this.concurrency = builder.concurrency;
    }

    public static AssessmentPolicy defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Band classifyThroughput(double opsPerSecond) {
        return throughput.classify(opsPerSecond);
    }

    public Band classifyHitRatio(double ratio) {
        return hitRatio.classify(ratio);
    }

    public Band classifyAdmitRatio(double ratio) {
        return admitRatio.classify(ratio);
    }

    public Band classifyP95Latency(Duration p95) {
        return p95LatencyMillis.classify(p95.toNanos() / 1_000_000.0);
    }

    /**
     * Bands how many connections could be held open at the same time.
     */
    public Band classifyConcurrency(int establishedConnections) {
        return concurrency.classify(establishedConnections);
    }

    /**
     * Bands the mean throughput of several phases, as a whole-run verdict.
     */
    public Band classifyMeanThroughput(List<LoadTestReport> reports) {
        if (reports == null || reports.isEmpty())
            throw new IllegalArgumentException("at least one report is required");
        double mean = reports.stream().mapToDouble(LoadTestReport::getOpsPerSecond).average().orElse(0.0);
        return classifyThroughput(mean);
    }

    public Assessment assess(LoadTestReport report, OutcomeKind kind) {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(kind, "kind");
        Band latency = report.getP95Latency().map(this::classifyP95Latency).orElse(null);
        return new Assessment(report.getPhase(), classifyThroughput(report.getOpsPerSecond()), latency,
            classifyOutcome(report.getOutcomeRatio(), kind).orElse(null));
    }

    public Assessment assess(LoadTestReport report) {
        return assess(report, OutcomeKind.NONE);
    }

    private Optional<Band> classifyOutcome(OptionalDouble ratio, OutcomeKind kind) {
        if (ratio.isEmpty())
            return Optional.empty();
        switch (kind) {
            case HIT:
                return Optional.of(classifyHitRatio(ratio.getAsDouble()));
            case ADMIT:
                return Optional.of(classifyAdmitRatio(ratio.getAsDouble()));
            default:
                return Optional.empty();
        }
    }

    public static class Builder {
        private BandThresholds throughput = BandThresholds.higherIsBetter(100_000, 50_000);
        private BandThresholds hitRatio = BandThresholds.higherIsBetter(0.90, 0.70);
        private BandThresholds admitRatio = BandThresholds.higherIsBetter(0.90, 0.70);
        private BandThresholds p95LatencyMillis = BandThresholds.lowerIsBetter(100, 200);
        private BandThresholds concurrency = BandThresholds.higherIsBetter(1_000, 500);

        public Builder throughput(double excellentAtLeast, double goodAtLeast) {
            this.throughput = BandThresholds.higherIsBetter(excellentAtLeast, goodAtLeast);
            return this;
        }

        public Builder hitRatio(double excellentAtLeast, double goodAtLeast) {
            this.hitRatio = ratio(excellentAtLeast, goodAtLeast);
            return this;
        }

        public Builder admitRatio(double excellentAtLeast, double goodAtLeast) {
            this.admitRatio = ratio(excellentAtLeast, goodAtLeast);
            return this;
        }

        public Builder p95Latency(Duration excellentBelow, Duration goodBelow) {
            this.p95LatencyMillis = BandThresholds.lowerIsBetter(
                excellentBelow.toNanos() / 1_000_000.0, goodBelow.toNanos() / 1_000_000.0);
            return this;
        }

        public Builder concurrency(int excellentAtLeast, int goodAtLeast) {
            if (goodAtLeast < 0)
                throw new ConfigurationException("concurrency thresholds must be >= 0");
            this.concurrency = BandThresholds.higherIsBetter(excellentAtLeast, goodAtLeast);
            return this;
        }

        public AssessmentPolicy build() {
            return new AssessmentPolicy(this);
        }

        private static BandThresholds ratio(double excellentAtLeast, double goodAtLeast) {
            if (excellentAtLeast > 1.0 || goodAtLeast < 0.0)
                throw new ConfigurationException("ratio thresholds must lie in [0, 1]");
            return BandThresholds.higherIsBetter(excellentAtLeast, goodAtLeast);
        }
    }
}
