package io.llmanalytics.backpressure.loadtest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.llmanalytics.backpressure.ConfigurationException;
import io.llmanalytics.backpressure.limiter.metrics.MetricNames;
import io.llmanalytics.backpressure.limiter.metrics.MetricPublisher;
import io.llmanalytics.backpressure.limiter.metrics.NoOpMetricPublisher;
import io.llmanalytics.backpressure.limiter.reliability.RetryPolicy;

/**
 * Fans a phase out over concurrent workers and joins them into one report.
 *
 * Each phase gets its own fixed pool with one thread per worker; workers never outlive their phase.
 * totalOps is split evenly, and the remainder of totalOps / concurrency is dropped on purpose, so a
 * phase runs at most totalOps calls (105 ops over 10 workers runs 100).
 *
 * The phase clock starts before the first worker is submitted and stops after the last worker's
 * results are collected. A worker whose setup fails, even after the configured retries, is lost:
 * it adds no results and shows up in {@link LoadTestReport#getLostWorkers()}, separately from
 * per-call errors. Siblings keep running. With a phase timeout, workers still running when it
 * elapses are cancelled and counted as lost; finished workers are aggregated as usual.
 *
 * Apart from ConfigurationException for bad arguments, runPhase always returns a report.
 */
public class LoadHarness {
  private static final Logger logger = LoggerFactory.getLogger(LoadHarness.class);

  private final RetryPolicy setupRetryPolicy;
  private final Duration phaseTimeout;
  private final MetricPublisher metricPublisher;

  private LoadHarness(Builder builder) {
    this.setupRetryPolicy = builder.setupRetryPolicy == null ? RetryPolicy.noRetry() : builder.setupRetryPolicy;
    this.phaseTimeout = builder.phaseTimeout;
    this.metricPublisher = builder.metricPublisher == null ? new NoOpMetricPublisher() : builder.metricPublisher;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public LoadTestReport runPhase(String phase, int totalOps, int concurrency, OperationFactory operationFactory) {
    if (phase == null)
      throw new ConfigurationException("phase name is required");
    if (operationFactory == null)
      throw new ConfigurationException("operationFactory is required");
    if (concurrency <= 0)
      throw new ConfigurationException("concurrency must be > 0, got: " + concurrency);
    if (totalOps < 0)
      throw new ConfigurationException("totalOps must be >= 0, got: " + totalOps);

    int perWorker = totalOps / concurrency;
    long planned = (long) perWorker * concurrency;
    if (planned != totalOps) {
      logger.debug("Phase {}: dropping {} ops that do not divide evenly over {} workers",
          phase, totalOps - planned, concurrency);
    }

    List<Callable<List<OperationResult>>> tasks = new ArrayList<>(concurrency);
    for (int i = 0; i < concurrency; i++) {
      final int index = i;
      tasks.add(() -> new Worker(index).run(setUp(index, operationFactory), perWorker));
    }

    logger.info("Phase {}: {} workers x {} ops", phase, concurrency, perWorker);
    ExecutorService pool = newPool(phase, concurrency);
    List<OperationResult> results = new ArrayList<>((int) planned);
    int lost = 0;
    long start = System.nanoTime();
    try {
      List<Future<List<OperationResult>>> futures = invokeAll(pool, tasks);
      if (futures.isEmpty())
        lost = concurrency;
      for (int i = 0; i < futures.size(); i++) {
        try {
          results.addAll(futures.get(i).get());
        } catch (ExecutionException e) {
          lost++;
          Throwable cause = e.getCause();
          int worker = cause instanceof WorkerFatalException ? ((WorkerFatalException) cause).getWorkerIndex() : i;
          logger.warn("Phase {}: worker {} lost", phase, worker, cause);
        } catch (CancellationException e) {
          lost++;
          logger.warn("Phase {}: worker {} cancelled after phase timeout {}", phase, i, phaseTimeout);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          lost += futures.size() - i;
          logger.warn("Phase {}: interrupted while collecting results", phase);
          break;
        }
      }
    } finally {
      pool.shutdownNow();
    }
    Duration totalTime = Duration.ofNanos(System.nanoTime() - start);

    LoadTestReport report = MetricsAggregator.reduce(phase, results, totalTime, planned, lost);
    publish(report);
    logger.info("Phase {} done: {} ops in {} ms ({} ops/s), {} errors, {} lost workers",
        phase, report.getTotalOps(), totalTime.toMillis(), Math.round(report.getOpsPerSecond()),
        report.getErrorCount(), report.getLostWorkers());
    return report;
  }

  private Operation setUp(int index, OperationFactory factory) {
    try {
      Operation operation = setupRetryPolicy.execute(() -> factory.create(index));
      return Objects.requireNonNull(operation, "operation factory returned null");
    } catch (Exception e) {
      throw new WorkerFatalException(index, e);
    }
  }

  private List<Future<List<OperationResult>>> invokeAll(ExecutorService pool,
      List<Callable<List<OperationResult>>> tasks) {
    try {
      if (phaseTimeout == null)
        return pool.invokeAll(tasks);
      return pool.invokeAll(tasks, phaseTimeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for workers, no results collected");
      return Collections.emptyList();
    }
  }

  private void publish(LoadTestReport report) {
    metricPublisher.incrementCounter(MetricNames.COMPLETED_OPERATIONS, report.getSuccessCount());
    metricPublisher.incrementCounter(MetricNames.FAILED_OPERATIONS, report.getErrorCount());
    metricPublisher.incrementCounter(MetricNames.LOST_WORKERS, report.getLostWorkers());
    metricPublisher.gauge(MetricNames.PHASE_OPS_PER_SECOND, report.getOpsPerSecond());
    metricPublisher.flush();
  }

  private static ExecutorService newPool(String phase, int concurrency) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(concurrency, r -> {
      Thread t = new Thread(r, "load-" + phase.toLowerCase(Locale.ROOT) + "-worker-" + counter.getAndIncrement());
      t.setDaemon(true);
      return t;
    });
  }

  public static class Builder {
    private RetryPolicy setupRetryPolicy = null;
    private Duration phaseTimeout = null;
    private MetricPublisher metricPublisher = null;

    public Builder setupRetryPolicy(RetryPolicy rp) {
      this.setupRetryPolicy = rp;
      return this;
    }

    /**
     * Upper bound on a phase's duration. Null (the default) waits for every worker.
     */
    public Builder phaseTimeout(Duration timeout) {
      if (timeout != null && (timeout.isNegative() || timeout.isZero()))
        throw new ConfigurationException("phaseTimeout must be > 0, got: " + timeout);
      this.phaseTimeout = timeout;
      return this;
    }

    public Builder metricPublisher(MetricPublisher mp) {
      this.metricPublisher = mp;
      return this;
    }

    public LoadHarness build() {
      return new LoadHarness(this);
    }
  }
}
