package io.llmanalytics.backpressure.limiter.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus-backed MetricPublisher for environments with a Prometheus scrape.
 *
 * Counter increments land in per-counter buffers on the hot path (a single atomic add) and are
 * moved into the real Prometheus counters once a second. Gauges are set directly.
 * Unknown metric names are ignored.
 */
public class PrometheusMetricPublisher implements MetricPublisher, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(PrometheusMetricPublisher.class);

  private final CollectorRegistry registry;
  private final Map<String, BufferedCounter> counters = new LinkedHashMap<>();
  private final Map<String, Gauge> gauges = new LinkedHashMap<>();
  private final ScheduledExecutorService scheduler;

  public PrometheusMetricPublisher(CollectorRegistry registry, String namespace) {
    this.registry = registry == null ? CollectorRegistry.defaultRegistry : registry;

    counter(namespace, MetricNames.ADMITTED_REQUESTS, "admitted_requests_total", "Rate limit checks that admitted the request");
    counter(namespace, MetricNames.DENIED_REQUESTS, "denied_requests_total", "Rate limit checks that denied the request");
    counter(namespace, MetricNames.FAIL_OPEN_EVENTS, "fail_open_total", "Checks admitted because the store was unavailable");
    counter(namespace, MetricNames.STORE_FAILURES, "store_failures_total", "Number of store failures observed");
    counter(namespace, MetricNames.COMPLETED_OPERATIONS, "completed_operations_total", "Load harness operations that succeeded");
    counter(namespace, MetricNames.FAILED_OPERATIONS, "failed_operations_total", "Load harness operations that failed");
    counter(namespace, MetricNames.LOST_WORKERS, "lost_workers_total", "Load harness workers lost before producing results");

    gauge(namespace, MetricNames.CIRCUIT_BREAKER_OPEN, "circuit_breaker_open", "1 if circuit breaker is open, 0 otherwise");
    gauge(namespace, MetricNames.PHASE_OPS_PER_SECOND, "phase_ops_per_second", "Throughput of the most recent load phase");

    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "prometheus-metric-flusher");
      t.setDaemon(true);
      return t;
    });
    this.scheduler.scheduleAtFixedRate(this::flushSafely, 1, 1, TimeUnit.SECONDS);
  }

  @Override
  public void incrementCounter(String name, long delta) {
    BufferedCounter c = counters.get(name);
    if (c != null)
      c.buffer.addAndGet(delta);
  }

  @Override
  public void gauge(String name, double value) {
    Gauge g = gauges.get(name);
    if (g != null)
      g.set(value);
  }

  @Override
  public void flush() {
    for (BufferedCounter c : counters.values()) {
      long pending = c.buffer.getAndSet(0);
      if (pending > 0)
        c.counter.inc(pending);
    }
  }

  @Override
  public void close() {
    try {
      scheduler.shutdown();
      scheduler.awaitTermination(1, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    flush();
  }

  private void flushSafely() {
    try {
      flush();
    } catch (RuntimeException e) {
      logger.warn("Error flushing Prometheus buffers", e);
    }
  }

  private void counter(String namespace, String metric, String name, String help) {
    Counter c = Counter.build()
        .namespace(namespace)
        .name(name)
        .help(help)
        .register(registry);
    counters.put(metric, new BufferedCounter(c));
  }

  private void gauge(String namespace, String metric, String name, String help) {
    Gauge g = Gauge.build()
        .namespace(namespace)
        .name(name)
        .help(help)
        .register(registry);
    gauges.put(metric, g);
  }

  private static final class BufferedCounter {
    private final Counter counter;
    private final AtomicLong buffer = new AtomicLong(0);

    private BufferedCounter(Counter counter) {
      this.counter = counter;
    }
  }
}
