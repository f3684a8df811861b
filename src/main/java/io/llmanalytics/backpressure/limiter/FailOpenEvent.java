package io.llmanalytics.backpressure.limiter;

import java.time.Instant;
import java.util.Objects;

/**
 * Emitted once per check that was admitted because the store failed.
 */
public final class FailOpenEvent {
  private final String key;
  private final Throwable cause;
  private final Instant timestamp;

  public FailOpenEvent(String key, Throwable cause, Instant timestamp) {
    this.key = Objects.requireNonNull(key, "key");
    this.cause = Objects.requireNonNull(cause, "cause");
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
  }

  public String getKey() {
    return key;
  }

  public Throwable getCause() {
    return cause;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return "FailOpenEvent{key=" + key + ", cause=" + cause + ", timestamp=" + timestamp + "}";
  }
}
