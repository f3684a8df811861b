package io.llmanalytics.backpressure.loadtest;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.llmanalytics.backpressure.loadtest.assessment.Assessment;
import io.llmanalytics.backpressure.loadtest.assessment.Band;

/**
 * Writes reports through SLF4J, one line per figure. Used by the command-line runner.
 */
public class LoggingReportSink implements ReportSink {
  private static final Logger logger = LoggerFactory.getLogger(LoggingReportSink.class);

  @Override
  public void accept(LoadTestReport report, Assessment assessment) {
    logger.info("{} results:", report.getPhase());
    logger.info("  Total operations:  {} (planned {})", report.getTotalOps(), report.getPlannedOps());
    logger.info("  Total time:        {} ms", report.getTotalTime().toMillis());
    logger.info("  Operations/sec:    {}", Math.round(report.getOpsPerSecond()));
    logger.info("  Avg latency:       {}", millis(report.getAverageLatency()));
    logger.info("  P95 latency:       {}", millis(report.getP95Latency()));
    logger.info("  P99 latency:       {}", millis(report.getP99Latency()));
    logger.info("  Errors:            {}", report.getErrorCount());
    if (report.getLostWorkers() > 0)
      logger.warn("  Lost workers:      {}", report.getLostWorkers());
    report.getOutcomeRatio().ifPresent(r -> logger.info("  Outcome ratio:     {}%", Math.round(r * 1000) / 10.0));
    logger.info("  Throughput band:   {}", assessment.getThroughput());
    assessment.getLatency().ifPresent(b -> logger.info("  Latency band:      {}", b));
    assessment.getOutcomeRatio().ifPresent(b -> logger.info("  Outcome band:      {}", b));
  }

  @Override
  public void connections(ConnectionReport report, Band concurrency) {
    logger.info("CONNECTIONS results:");
    logger.info("  Requested:         {} (pool size {})", report.getRequested(), report.getPoolSize());
    logger.info("  Established:       {}", report.getEstablished());
    if (report.getFailed() > 0)
      logger.warn("  Failed:            {}", report.getFailed());
    logger.info("  Acquisition time:  {} ms", report.getAcquisitionTime().toMillis());
    logger.info("  Concurrency band:  {}", concurrency);
  }

  @Override
  public void summary(List<LoadTestReport> reports, Band meanThroughput) {
    logger.info("Mean throughput over {} phases: {}", reports.size(), meanThroughput);
  }

  private static String millis(Optional<Duration> d) {
    return d.map(v -> String.format("%.3f ms", v.toNanos() / 1_000_000.0)).orElse("insufficient data");
  }
}
