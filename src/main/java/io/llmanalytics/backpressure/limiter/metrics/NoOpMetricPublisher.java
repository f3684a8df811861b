package io.llmanalytics.backpressure.limiter.metrics;

/**
 * Default publisher so the limiter and harness run without any metrics backend.
 */
public class NoOpMetricPublisher implements MetricPublisher {
    @Override public void incrementCounter(String name, long delta) {}
    @Override public void gauge(String name, double value) {}
}
