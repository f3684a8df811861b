package io.llmanalytics.backpressure.limiter.metrics;

/**
 * Minimal metrics publishing interface used by the limiter and the load harness.
 * Implementations must never throw: metrics are best effort.
 */
public interface MetricPublisher {

  void incrementCounter(String name, long delta);

  void gauge(String name, double value);

  default void flush() {}
}
