package io.llmanalytics.backpressure.limiter.metrics;

import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CloudWatch MetricPublisher. Data points are queued and sent with PutMetricData in batches of
 * at most {@value #MAX_BATCH}, either when the batch fills up or on {@link #flush()}.
 * Every datum carries a Service dimension so several limiter deployments can share a namespace.
 */
public class CloudWatchMetricPublisher implements MetricPublisher {
  static final int MAX_BATCH = 20;

  private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricPublisher.class);

  private final CloudWatchClient client;
  private final String namespace;
  private final Dimension service;
  private final List<MetricDatum> queued = new ArrayList<>();

  public CloudWatchMetricPublisher(CloudWatchClient client, String namespace) {
    this(client, namespace, "backpressure");
  }

  public CloudWatchMetricPublisher(CloudWatchClient client, String namespace, String serviceName) {
    this.client = client;
    this.namespace = namespace == null ? "Backpressure" : namespace;
    this.service = Dimension.builder().name("Service").value(serviceName).build();
  }

  @Override
  public void incrementCounter(String name, long delta) {
    enqueue(name, (double) delta, StandardUnit.COUNT);
  }

  @Override
  public void gauge(String name, double value) {
    enqueue(name, value, StandardUnit.NONE);
  }

  @Override
  public void flush() {
    List<MetricDatum> batch;
    synchronized (queued) {
      if (queued.isEmpty())
        return;
      batch = new ArrayList<>(queued);
      queued.clear();
    }
    send(batch);
  }

  private void enqueue(String name, double value, StandardUnit unit) {
    MetricDatum datum = MetricDatum.builder()
        .metricName(name)
        .value(value)
        .unit(unit)
        .timestamp(Instant.now())
        .dimensions(service)
        .build();
    List<MetricDatum> full = null;
    synchronized (queued) {
      queued.add(datum);
      if (queued.size() >= MAX_BATCH) {
        full = new ArrayList<>(queued);
        queued.clear();
      }
    }
    if (full != null)
      send(full);
  }

  private void send(List<MetricDatum> batch) {
    try {
      PutMetricDataRequest req = PutMetricDataRequest.builder()
          .namespace(this.namespace)
          .metricData(batch)
          .build();
      client.putMetricData(req);
    } catch (RuntimeException e) {
      // best-effort; do not throw from metrics
      logger.warn("Failed to publish {} CloudWatch data points", batch.size(), e);
    }
  }
}
