package io.llmanalytics.backpressure.limiter;

import io.llmanalytics.backpressure.limiter.metrics.MetricNames;
import io.llmanalytics.backpressure.limiter.metrics.MetricPublisher;
import io.llmanalytics.backpressure.limiter.metrics.NoOpMetricPublisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default fail-open sink: logs a warning with the key and cause and bumps the FailOpenEvents counter.
 */
public class MetricsFailOpenListener implements FailOpenListener {
  private static final Logger logger = LoggerFactory.getLogger(MetricsFailOpenListener.class);

  private final MetricPublisher metricPublisher;

  public MetricsFailOpenListener() {
    this(new NoOpMetricPublisher());
  }

  public MetricsFailOpenListener(MetricPublisher metricPublisher) {
    this.metricPublisher = metricPublisher;
  }

  @Override
  public void onFailOpen(FailOpenEvent event) {
    logger.warn("Rate limit check for key {} failed open at {}: {}",
        event.getKey(), event.getTimestamp(), event.getCause().toString());
    metricPublisher.incrementCounter(MetricNames.FAIL_OPEN_EVENTS, 1);
  }
}
