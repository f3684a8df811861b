package io.llmanalytics.backpressure.loadtest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.llmanalytics.backpressure.ConfigurationException;
import io.llmanalytics.backpressure.store.BackingStoreException;
import io.llmanalytics.backpressure.store.PooledTimeOrderedStore;

/**
 * Checks out connections concurrently, holds all of them at once, pings each and gives them back.
 *
 * Every attempt runs on its own thread. Connections are only returned after every attempt has
 * finished, so asking for more than the pool size makes the surplus attempts time out.
 */
public class ConnectionCheck {
  private static final Logger logger = LoggerFactory.getLogger(ConnectionCheck.class);

  public ConnectionReport run(PooledTimeOrderedStore pool, int connections) {
    if (pool == null)
      throw new ConfigurationException("pool is required");
    if (connections <= 0)
      throw new ConfigurationException("connections must be > 0, got: " + connections);

    logger.info("Acquiring {} connections from a pool of {}", connections, pool.getPoolSize());
    CountDownLatch attempted = new CountDownLatch(connections);
    CountDownLatch allAttempted = new CountDownLatch(1);
    AtomicInteger acquired = new AtomicInteger();
    ExecutorService executor = newPool(connections);
    List<Future<Boolean>> futures = new ArrayList<>(connections);

    long start = System.nanoTime();
    Duration acquisitionTime;
    int established = 0;
    try {
      for (int i = 0; i < connections; i++)
        futures.add(executor.submit(() -> hold(pool, attempted, allAttempted, acquired)));
      attempted.await();
      acquisitionTime = Duration.ofNanos(System.nanoTime() - start);
      allAttempted.countDown();

      for (Future<Boolean> f : futures) {
        try {
          if (f.get())
            established++;
        } catch (ExecutionException e) {
          logger.debug("Connection attempt failed", e.getCause());
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      acquisitionTime = Duration.ofNanos(System.nanoTime() - start);
      logger.warn("Interrupted while holding connections");
    } finally {
      allAttempted.countDown();
      executor.shutdownNow();
    }

    ConnectionReport report = new ConnectionReport(connections, pool.getPoolSize(), acquired.get(), established,
        acquisitionTime);
    logger.info("Connections: {} of {} established, acquired in {} ms", established, connections,
        acquisitionTime.toMillis());
    return report;
  }

  private static boolean hold(PooledTimeOrderedStore pool, CountDownLatch attempted, CountDownLatch allAttempted,
      AtomicInteger acquired) throws InterruptedException {
    PooledTimeOrderedStore.Connection connection;
    try {
      connection = pool.acquireConnection();
      acquired.incrementAndGet();
    } catch (BackingStoreException e) {
      logger.debug("No connection: {}", e.getMessage());
      return false;
    } finally {
      attempted.countDown();
    }
    try (PooledTimeOrderedStore.Connection c = connection) {
      allAttempted.await();
      c.ping();
      return true;
    } catch (BackingStoreException e) {
      logger.debug("Ping failed: {}", e.getMessage());
      return false;
    }
  }

  private static ExecutorService newPool(int connections) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(connections, r -> {
      Thread t = new Thread(r, "load-connections-" + counter.getAndIncrement());
      t.setDaemon(true);
      return t;
    });
  }
}
