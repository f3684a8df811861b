package io.llmanalytics.backpressure.loadtest;

import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

import io.llmanalytics.backpressure.ConfigurationException;
import io.llmanalytics.backpressure.limiter.reliability.RetryPolicy;

/**
 * Settings of a load test run. Immutable; every value is validated in {@link Builder#build()}
 * and a bad value fails the run before any phase starts.
 */
public final class LoadTestConfig {
  public static final String PREFIX = "backpressure.";

  private final int limit;
  private final Duration window;
  private final int concurrency;
  private final int totalOps;
  private final int keySpaceSize;
  private final int poolSize;
  private final int connections;
  private final Duration acquireTimeout;
  private final Duration phaseTimeout;
  private final RetryPolicy setupRetryPolicy;

  private LoadTestConfig(Builder builder) {
    this.limit = builder.limit;
    this.window = builder.window;
    this.concurrency = builder.concurrency;
    this.totalOps = builder.totalOps;
    this.keySpaceSize = builder.keySpaceSize;
    this.poolSize = builder.poolSize;
    this.connections = builder.connections == 0 ? builder.poolSize : builder.connections;
    this.acquireTimeout = builder.acquireTimeout;
    this.phaseTimeout = builder.phaseTimeout;
    this.setupRetryPolicy = RetryPolicy.of(builder.setupRetryAttempts, builder.setupRetryBackoff);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Reads backpressure.* keys; absent keys keep the builder defaults.
   *
   * <pre>
   * backpressure.limit                    max admitted units per window
   * backpressure.window-ms                window length
   * backpressure.concurrency              workers per phase
   * backpressure.total-ops                operations per phase
   * backpressure.key-space-size           distinct synthetic keys
   * backpressure.pool-size                store connections
   * backpressure.acquire-timeout-ms       wait for a free connection
   * backpressure.connections              held at once by the connection check; 0 or absent: pool-size
   * backpressure.phase-timeout-ms         0 or absent: no timeout
   * backpressure.setup-retry-attempts     worker setup attempts
   * backpressure.setup-retry-backoff-ms   pause between setup attempts
   * </pre>
   */
  public static LoadTestConfig fromProperties(Properties props) {
    Builder b = newBuilder();
    intProp(props, "limit").ifPresent(b::limit);
    longProp(props, "window-ms").ifPresent(ms -> b.window(Duration.ofMillis(ms)));
    intProp(props, "concurrency").ifPresent(b::concurrency);
    intProp(props, "total-ops").ifPresent(b::totalOps);
    intProp(props, "key-space-size").ifPresent(b::keySpaceSize);
    intProp(props, "pool-size").ifPresent(b::poolSize);
    intProp(props, "connections").ifPresent(b::connections);
    longProp(props, "acquire-timeout-ms").ifPresent(ms -> b.acquireTimeout(Duration.ofMillis(ms)));
    longProp(props, "phase-timeout-ms").ifPresent(ms -> b.phaseTimeout(ms == 0 ? null : Duration.ofMillis(ms)));
    intProp(props, "setup-retry-attempts").ifPresent(b::setupRetryAttempts);
    longProp(props, "setup-retry-backoff-ms").ifPresent(ms -> b.setupRetryBackoff(Duration.ofMillis(ms)));
    return b.build();
  }

  private static Optional<Integer> intProp(Properties props, String name) {
    return longProp(props, name).map(v -> {
      if (v > Integer.MAX_VALUE || v < Integer.MIN_VALUE)
        throw new ConfigurationException(PREFIX + name + " out of range: " + v);
      return v.intValue();
    });
  }

  private static Optional<Long> longProp(Properties props, String name) {
    String raw = props.getProperty(PREFIX + name);
    if (raw == null || raw.isBlank())
      return Optional.empty();
    try {
      return Optional.of(Long.parseLong(raw.trim()));
    } catch (NumberFormatException e) {
      throw new ConfigurationException(PREFIX + name + " is not a number: " + raw, e);
    }
  }

  public int getLimit() { return limit; }
  public Duration getWindow() { return window; }
  public int getConcurrency() { return concurrency; }
  public int getTotalOps() { return totalOps; }
  public int getKeySpaceSize() { return keySpaceSize; }
  public int getPoolSize() { return poolSize; }
  public int getConnections() { return connections; }
  public Duration getAcquireTimeout() { return acquireTimeout; }
  public Optional<Duration> getPhaseTimeout() { return Optional.ofNullable(phaseTimeout); }
  public RetryPolicy getSetupRetryPolicy() { return setupRetryPolicy; }

  @Override
  public String toString() {
    return "LoadTestConfig{limit=" + limit + ", window=" + window + ", concurrency=" + concurrency
        + ", totalOps=" + totalOps + ", keySpaceSize=" + keySpaceSize + ", poolSize=" + poolSize
        + ", connections=" + connections + ", acquireTimeout=" + acquireTimeout + ", phaseTimeout=" + phaseTimeout + "}";
  }

  public static class Builder {
    private int limit = 100;
    private Duration window = Duration.ofSeconds(60);
    private int concurrency = 100;
    private int totalOps = 100_000;
    private int keySpaceSize = 10_000;
    private int poolSize = 100;
    private int connections = 0;
    private Duration acquireTimeout = Duration.ofSeconds(1);
    private Duration phaseTimeout = null;
    private int setupRetryAttempts = 3;
    private Duration setupRetryBackoff = Duration.ofMillis(10);

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder window(Duration window) {
      this.window = window;
      return this;
    }

    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    public Builder totalOps(int totalOps) {
      this.totalOps = totalOps;
      return this;
    }

    public Builder keySpaceSize(int size) {
      this.keySpaceSize = size;
      return this;
    }

    public Builder poolSize(int size) {
      this.poolSize = size;
      return this;
    }

    /**
     * Connections the connection check holds at once. 0 (the default) means the pool size.
     */
    public Builder connections(int connections) {
      this.connections = connections;
      return this;
    }

    public Builder acquireTimeout(Duration timeout) {
      this.acquireTimeout = timeout;
      return this;
    }

    public Builder phaseTimeout(Duration timeout) {
      this.phaseTimeout = timeout;
      return this;
    }

    public Builder setupRetryAttempts(int attempts) {
      this.setupRetryAttempts = attempts;
      return this;
    }

    public Builder setupRetryBackoff(Duration backoff) {
      this.setupRetryBackoff = backoff;
      return this;
    }

    public LoadTestConfig build() {
      if (limit <= 0)
        throw new ConfigurationException("limit must be > 0, got: " + limit);
      if (window == null || window.isNegative() || window.isZero())
        throw new ConfigurationException("window must be > 0, got: " + window);
      if (concurrency <= 0)
        throw new ConfigurationException("concurrency must be > 0, got: " + concurrency);
      if (totalOps < 0)
        throw new ConfigurationException("totalOps must be >= 0, got: " + totalOps);
      if (keySpaceSize <= 0)
        throw new ConfigurationException("keySpaceSize must be > 0, got: " + keySpaceSize);
      if (poolSize <= 0)
        throw new ConfigurationException("poolSize must be > 0, got: " + poolSize);
      if (connections < 0)
        throw new ConfigurationException("connections must be >= 0, got: " + connections);
      if (acquireTimeout == null || acquireTimeout.isNegative())
        throw new ConfigurationException("acquireTimeout must be >= 0, got: " + acquireTimeout);
      if (phaseTimeout != null && (phaseTimeout.isNegative() || phaseTimeout.isZero()))
        throw new ConfigurationException("phaseTimeout must be > 0, got: " + phaseTimeout);
      if (setupRetryAttempts <= 0)
        throw new ConfigurationException("setupRetryAttempts must be > 0, got: " + setupRetryAttempts);
      if (setupRetryBackoff == null || setupRetryBackoff.isNegative())
        throw new ConfigurationException("setupRetryBackoff must be >= 0, got: " + setupRetryBackoff);
      return new LoadTestConfig(this);
    }
  }
}
