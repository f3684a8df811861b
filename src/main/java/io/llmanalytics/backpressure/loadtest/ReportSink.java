package io.llmanalytics.backpressure.loadtest;

import java.util.List;

import io.llmanalytics.backpressure.loadtest.assessment.Assessment;
import io.llmanalytics.backpressure.loadtest.assessment.Band;

/**
 * Receives each phase's report and assessment as structured data. Presentation is up to the sink.
 */
public interface ReportSink {

  void accept(LoadTestReport report, Assessment assessment);

  /**
   * Result of the connection check and its concurrency band.
   */
  default void connections(ConnectionReport report, Band concurrency) {}

  /**
   * Whole-run verdict after every phase was reported. reports holds the phases the mean
   * throughput was taken over.
   */
  default void summary(List<LoadTestReport> reports, Band meanThroughput) {}
}
