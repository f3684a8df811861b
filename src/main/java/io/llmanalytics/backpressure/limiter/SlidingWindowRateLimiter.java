package io.llmanalytics.backpressure.limiter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

import io.llmanalytics.backpressure.ConfigurationException;
import io.llmanalytics.backpressure.limiter.metrics.MetricNames;
import io.llmanalytics.backpressure.limiter.metrics.MetricPublisher;
import io.llmanalytics.backpressure.limiter.metrics.NoOpMetricPublisher;
import io.llmanalytics.backpressure.limiter.reliability.CircuitBreaker;
import io.llmanalytics.backpressure.limiter.reliability.CircuitOpenException;
import io.llmanalytics.backpressure.store.BackingStoreException;
import io.llmanalytics.backpressure.store.TimeOrderedStore;

/**
 * Sliding-window (log) rate limiter backed by a shared TimeOrderedStore.
 *
 * Every admitted unit of work is recorded as one member of a per-key ordered set, scored by its
 * admission time in epoch milliseconds. A check:
 * <ol>
 * <li>removes members scored strictly below now - window,</li>
 * <li>counts what is left and denies when count >= limit, recording nothing,</li>
 * <li>otherwise adds a member scored now and re-applies the key's TTL to window.</li>
 * </ol>
 * The three steps run inside {@link TimeOrderedStore#atomically} so concurrent checks on the same
 * key cannot both see the last free slot. Members are "now:random:sequence", which keeps two
 * admissions in the same millisecond from collapsing into one stored member.
 *
 * The limiter holds no window state of its own. If the store fails (or the optional circuit
 * breaker is open) the check fails open: the request is admitted with the full limit remaining and
 * a FailOpenEvent goes to the configured listener. Availability of the protected service wins
 * over strict quota enforcement here; a caller that needs the opposite must not use this class.
 */
public class SlidingWindowRateLimiter {
  public static final String DEFAULT_KEY_PREFIX = "ratelimit:";

  private final TimeOrderedStore store;
  private final Clock clock;
  private final String keyPrefix;
  private final CircuitBreaker circuitBreaker;
  private final MetricPublisher metricPublisher;
  private final FailOpenListener failOpenListener;
  private final AtomicLong sequence = new AtomicLong();

  private SlidingWindowRateLimiter(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.clock = builder.clock;
    this.keyPrefix = builder.keyPrefix;
    this.circuitBreaker = builder.circuitBreaker;
    this.metricPublisher = builder.metricPublisher == null ? new NoOpMetricPublisher() : builder.metricPublisher;
    this.failOpenListener = builder.failOpenListener == null
        ? new MetricsFailOpenListener(this.metricPublisher)
        : builder.failOpenListener;
  }

  public static Builder newBuilder(TimeOrderedStore store) {
    return new Builder(store);
  }

  /**
   * Checks key against the injected clock's current time.
   */
  public RateLimitDecision check(String key, int limit, Duration window) {
    return check(key, limit, window, clock.instant());
  }

  /**
   * Decides whether one more unit of work for key is admitted under limit per window, as of now.
   *
   * @throws ConfigurationException if window is null or shorter than one millisecond
   */
  public RateLimitDecision check(String key, int limit, Duration window, Instant now) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(now, "now");
    long windowMillis = windowMillis(window);

    if (limit <= 0) {
      metricPublisher.incrementCounter(MetricNames.DENIED_REQUESTS, 1);
      return RateLimitDecision.deny();
    }

    if (circuitBreaker != null && !circuitBreaker.allowRequest()) {
      return failOpen(key, limit, new CircuitOpenException(), now);
    }

    String storeKey = keyPrefix + key;
    long nowMillis = now.toEpochMilli();
    RateLimitDecision decision;
    try {
      decision = store.atomically(storeKey, s -> admit(s, storeKey, limit, window, windowMillis, nowMillis));
    } catch (BackingStoreException | RuntimeException ex) {
      if (circuitBreaker != null) {
        circuitBreaker.recordFailure();
        metricPublisher.gauge(MetricNames.CIRCUIT_BREAKER_OPEN, circuitBreaker.isOpen() ? 1 : 0);
      }
      metricPublisher.incrementCounter(MetricNames.STORE_FAILURES, 1);
      return failOpen(key, limit, ex, now);
    }

    if (circuitBreaker != null)
      circuitBreaker.recordSuccess();
    metricPublisher.incrementCounter(
        decision.isAllowed() ? MetricNames.ADMITTED_REQUESTS : MetricNames.DENIED_REQUESTS, 1);
    return decision;
  }

  private RateLimitDecision admit(TimeOrderedStore s, String storeKey, int limit, Duration window,
      long windowMillis, long nowMillis) throws BackingStoreException {
    // expire before counting so stale entries never inflate the count
    s.removeMembersBelow(storeKey, nowMillis - windowMillis);
    long count = s.countMembers(storeKey);
    if (count >= limit)
      return RateLimitDecision.deny();

    s.addTimedMember(storeKey, nowMillis, nextMember(nowMillis));
    s.setTtl(storeKey, window);
    return RateLimitDecision.allow((int) (limit - count - 1));
  }

  private RateLimitDecision failOpen(String key, int limit, Throwable cause, Instant now) {
    try {
      failOpenListener.onFailOpen(new FailOpenEvent(key, cause, now));
    } catch (RuntimeException listenerFailure) {
      // the listener must never turn a fail-open into a failed request
      cause.addSuppressed(listenerFailure);
    }
    return RateLimitDecision.failOpen(limit);
  }

  private String nextMember(long nowMillis) {
    return nowMillis + ":" + Long.toHexString(ThreadLocalRandom.current().nextLong()) + ":"
        + sequence.incrementAndGet();
  }

  private static long windowMillis(Duration window) {
    if (window == null || window.isNegative() || window.isZero())
      throw new ConfigurationException("window must be > 0, got: " + window);
    long millis = window.toMillis();
    if (millis < 1)
      throw new ConfigurationException("window must be at least 1ms, got: " + window);
    return millis;
  }

  public static class Builder {
    private final TimeOrderedStore store;
    private Clock clock = Clock.systemUTC();
    private String keyPrefix = DEFAULT_KEY_PREFIX;
    private CircuitBreaker circuitBreaker = null;
    private MetricPublisher metricPublisher = null;
    private FailOpenListener failOpenListener = null;

    public Builder(TimeOrderedStore store) {
      this.store = store;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder keyPrefix(String prefix) {
      this.keyPrefix = prefix == null ? "" : prefix;
      return this;
    }

    public Builder circuitBreaker(CircuitBreaker cb) {
      this.circuitBreaker = cb;
      return this;
    }

    public Builder metricPublisher(MetricPublisher mp) {
      this.metricPublisher = mp;
      return this;
    }

    public Builder failOpenListener(FailOpenListener listener) {
      this.failOpenListener = listener;
      return this;
    }

    public SlidingWindowRateLimiter build() {
      return new SlidingWindowRateLimiter(this);
    }
  }
}
