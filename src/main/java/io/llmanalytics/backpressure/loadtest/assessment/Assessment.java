package io.llmanalytics.backpressure.loadtest.assessment;

import java.util.Objects;
import java.util.Optional;

/**
 * Bands assigned to one phase. Bands whose input was missing (no latency sample large enough,
 * no successful calls for a ratio) are empty.
 */
public final class Assessment {
    private final String phase;
    private final Band throughput;
    private final Band latency;
    private final Band outcomeRatio;

    Assessment(String phase, Band throughput, Band latency, Band outcomeRatio) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.throughput = Objects.requireNonNull(throughput, "throughput");
        this.latency = latency;
        this.outcomeRatio = outcomeRatio;
    }

    public String getPhase() { return phase; }

    public Band getThroughput() { return throughput; }

    public Optional<Band> getLatency() { return Optional.ofNullable(latency); }

    public Optional<Band> getOutcomeRatio() { return Optional.ofNullable(outcomeRatio); }

    @Override
    public String toString() {
        return "Assessment{phase=" + phase + ", throughput=" + throughput + ", latency=" + latency
            + ", outcomeRatio=" + outcomeRatio + "}";
    }
}
