package io.llmanalytics.backpressure.limiter.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.prometheus.client.CollectorRegistry;

public class PrometheusMetricPublisherTest {
  private final CollectorRegistry registry = new CollectorRegistry();
  private PrometheusMetricPublisher publisher;

  @AfterEach
  public void tearDown() {
    if (publisher != null)
      publisher.close();
  }

  @Test
  public void bufferedCountersAreFlushed() throws Exception {
    publisher = new PrometheusMetricPublisher(registry, "TestNS");

    publisher.incrementCounter(MetricNames.ADMITTED_REQUESTS, 5);
    publisher.incrementCounter(MetricNames.FAIL_OPEN_EVENTS, 2);
    publisher.gauge(MetricNames.CIRCUIT_BREAKER_OPEN, 1);

    // wait for flush (flush runs every 1s)
    Thread.sleep(1200);

    assertEquals(5.0, value("TestNS_admitted_requests_total"), 0.0001);
    assertEquals(2.0, value("TestNS_fail_open_total"), 0.0001);
    assertEquals(1.0, value("TestNS_circuit_breaker_open"), 0.0001);
  }

  @Test
  public void explicitFlushAndHarnessMetrics() {
    publisher = new PrometheusMetricPublisher(registry, "LoadNS");

    publisher.incrementCounter(MetricNames.COMPLETED_OPERATIONS, 90);
    publisher.incrementCounter(MetricNames.FAILED_OPERATIONS, 10);
    publisher.incrementCounter(MetricNames.LOST_WORKERS, 1);
    publisher.gauge(MetricNames.PHASE_OPS_PER_SECOND, 1234.5);
    publisher.flush();

    assertEquals(90.0, value("LoadNS_completed_operations_total"), 0.0001);
    assertEquals(10.0, value("LoadNS_failed_operations_total"), 0.0001);
    assertEquals(1.0, value("LoadNS_lost_workers_total"), 0.0001);
    assertEquals(1234.5, value("LoadNS_phase_ops_per_second"), 0.0001);
  }

  @Test
  public void unknownNamesAreIgnored() {
    publisher = new PrometheusMetricPublisher(registry, "TestNS");
    publisher.incrementCounter("NoSuchCounter", 3);
    publisher.gauge("NoSuchGauge", 3);
    publisher.flush();

    assertNull(registry.getSampleValue("TestNS_NoSuchCounter_total"));
  }

  private double value(String sample) {
    Double v = registry.getSampleValue(sample);
    return v == null ? 0.0 : v;
  }
}
