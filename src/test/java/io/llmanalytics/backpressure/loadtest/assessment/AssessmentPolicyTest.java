package io.llmanalytics.backpressure.loadtest.assessment;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.llmanalytics.backpressure.ConfigurationException;
import io.llmanalytics.backpressure.loadtest.LoadTestReport;
import io.llmanalytics.backpressure.loadtest.MetricsAggregator;
import io.llmanalytics.backpressure.loadtest.OperationResult;
import io.llmanalytics.backpressure.loadtest.assessment.AssessmentPolicy.OutcomeKind;

public class AssessmentPolicyTest {

    private final AssessmentPolicy policy = AssessmentPolicy.defaults();

    private static LoadTestReport report(int calls, long latencyMillis, int positives, Duration totalTime) {
        List<OperationResult> results = new ArrayList<>();
        for (int i = 0; i < calls; i++)
            results.add(OperationResult.succeeded(Duration.ofMillis(latencyMillis).toNanos(), i < positives));
        return MetricsAggregator.reduce(results, totalTime);
    }

    @Test
    public void defaultThroughputBands() {
        assertEquals(Band.EXCELLENT, policy.classifyThroughput(100_000));
        assertEquals(Band.GOOD, policy.classifyThroughput(50_000));
        assertEquals(Band.GOOD, policy.classifyThroughput(99_999));
        assertEquals(Band.NEEDS_IMPROVEMENT, policy.classifyThroughput(49_999));
    }

    @Test
    public void defaultRatioBands() {
        assertEquals(Band.EXCELLENT, policy.classifyHitRatio(0.90));
        assertEquals(Band.GOOD, policy.classifyHitRatio(0.70));
        assertEquals(Band.NEEDS_IMPROVEMENT, policy.classifyHitRatio(0.69));
        assertEquals(Band.EXCELLENT, policy.classifyAdmitRatio(1.0));
        assertEquals(Band.NEEDS_IMPROVEMENT, policy.classifyAdmitRatio(0.0));
    }

    @Test
    public void defaultLatencyBands() {
        assertEquals(Band.EXCELLENT, policy.classifyP95Latency(Duration.ofMillis(99)));
        assertEquals(Band.GOOD, policy.classifyP95Latency(Duration.ofMillis(100)));
        assertEquals(Band.NEEDS_IMPROVEMENT, policy.classifyP95Latency(Duration.ofMillis(200)));
    }

    @Test
    public void defaultConcurrencyBands() {
        assertEquals(Band.EXCELLENT, policy.classifyConcurrency(1_000));
        assertEquals(Band.GOOD, policy.classifyConcurrency(999));
        assertEquals(Band.GOOD, policy.classifyConcurrency(500));
        assertEquals(Band.NEEDS_IMPROVEMENT, policy.classifyConcurrency(499));
    }

    @Test
    public void customThresholds() {
        AssessmentPolicy strict = AssessmentPolicy.newBuilder()
            .throughput(1_000, 500)
            .hitRatio(0.99, 0.95)
            .p95Latency(Duration.ofMillis(5), Duration.ofMillis(10))
            .concurrency(100, 50)
            .build();

        assertEquals(Band.EXCELLENT, strict.classifyThroughput(1_000));
        assertEquals(Band.NEEDS_IMPROVEMENT, strict.classifyHitRatio(0.90));
        assertEquals(Band.GOOD, strict.classifyP95Latency(Duration.ofMillis(7)));
        assertEquals(Band.EXCELLENT, strict.classifyConcurrency(100));
        assertEquals(Band.GOOD, strict.classifyConcurrency(50));
    }

    @Test
    public void rejectsRatioOutsideUnitInterval() {
        assertThrows(ConfigurationException.class, () -> AssessmentPolicy.newBuilder().hitRatio(1.5, 0.7));
        assertThrows(ConfigurationException.class, () -> AssessmentPolicy.newBuilder().admitRatio(0.9, -0.1));
        assertThrows(ConfigurationException.class, () -> AssessmentPolicy.newBuilder().throughput(10, 20));
        assertThrows(ConfigurationException.class, () -> AssessmentPolicy.newBuilder().concurrency(100, -1));
        assertThrows(ConfigurationException.class, () -> AssessmentPolicy.newBuilder().concurrency(100, 500));
    }

    @Test
    public void assessHitPhase() {
        LoadTestReport r = report(100, 1, 95, Duration.ofMillis(1));

        Assessment a = policy.assess(r, OutcomeKind.HIT);

        assertEquals(Band.EXCELLENT, a.getThroughput());
        assertEquals(Band.EXCELLENT, a.getLatency().orElseThrow());
        assertEquals(Band.EXCELLENT, a.getOutcomeRatio().orElseThrow());
    }

    @Test
    public void admitRatioUsesAdmitThresholds() {
        AssessmentPolicy lenientAdmit = AssessmentPolicy.newBuilder().admitRatio(0.5, 0.2).build();
        LoadTestReport r = report(20, 1, 10, Duration.ofSeconds(1));

        assertEquals(Band.EXCELLENT, lenientAdmit.assess(r, OutcomeKind.ADMIT).getOutcomeRatio().orElseThrow());
        assertEquals(Band.NEEDS_IMPROVEMENT, lenientAdmit.assess(r, OutcomeKind.HIT).getOutcomeRatio().orElseThrow());
    }

    @Test
    public void missingInputsGiveEmptyBands() {
        LoadTestReport small = report(5, 1, 5, Duration.ofSeconds(1));

        Assessment a = policy.assess(small, OutcomeKind.HIT);

        assertEquals(Band.NEEDS_IMPROVEMENT, a.getThroughput());
        assertTrue(a.getLatency().isEmpty());
        assertTrue(a.getOutcomeRatio().isPresent());
        assertTrue(policy.assess(small).getOutcomeRatio().isEmpty());

        LoadTestReport allFailed = MetricsAggregator.reduce(
            Collections.nCopies(30, OperationResult.failed()), Duration.ofSeconds(1));
        assertTrue(policy.assess(allFailed, OutcomeKind.HIT).getOutcomeRatio().isEmpty());
    }

    @Test
    public void meanThroughputAcrossPhases() {
        LoadTestReport fast = report(150, 0, 0, Duration.ofMillis(1));
        LoadTestReport slow = report(10, 0, 0, Duration.ofSeconds(1));

        // (150_000 + 10) / 2 sits in the good band
        assertEquals(Band.GOOD, policy.classifyMeanThroughput(List.of(fast, slow)));
        assertEquals(Band.EXCELLENT, policy.classifyMeanThroughput(List.of(fast)));
        assertThrows(IllegalArgumentException.class, () -> policy.classifyMeanThroughput(List.of()));
    }
}
