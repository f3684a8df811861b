package io.llmanalytics.backpressure.limiter.metrics;

/**
 * Names of the counters and gauges emitted through {@link MetricPublisher}.
 */
public final class MetricNames {

  // rate limiter
  public static final String ADMITTED_REQUESTS = "AdmittedRequests";
  public static final String DENIED_REQUESTS = "DeniedRequests";
  public static final String FAIL_OPEN_EVENTS = "FailOpenEvents";
  public static final String STORE_FAILURES = "StoreFailures";
  public static final String CIRCUIT_BREAKER_OPEN = "CircuitBreakerOpen";

  // load harness
  public static final String COMPLETED_OPERATIONS = "CompletedOperations";
  public static final String FAILED_OPERATIONS = "FailedOperations";
  public static final String LOST_WORKERS = "LostWorkers";
  public static final String PHASE_OPS_PER_SECOND = "PhaseOpsPerSecond";

  private MetricNames() {
  }
}
