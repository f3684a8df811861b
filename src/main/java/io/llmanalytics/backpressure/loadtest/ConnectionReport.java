package io.llmanalytics.backpressure.loadtest;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of holding many pool connections at once.
 */
public final class ConnectionReport {
  private final int requested;
  private final int poolSize;
  private final int acquired;
  private final int established;
  private final Duration acquisitionTime;

  ConnectionReport(int requested, int poolSize, int acquired, int established, Duration acquisitionTime) {
    this.requested = requested;
    this.poolSize = poolSize;
    this.acquired = acquired;
    this.established = established;
    this.acquisitionTime = Objects.requireNonNull(acquisitionTime, "acquisitionTime");
  }

  public int getRequested() { return requested; }

  public int getPoolSize() { return poolSize; }

  /**
   * Connections checked out before the acquire timeout.
   */
  public int getAcquired() { return acquired; }

  /**
   * Acquired connections whose ping also succeeded.
   */
  public int getEstablished() { return established; }

  public int getFailed() { return requested - established; }

  /**
   * From the first acquire attempt until every attempt had either succeeded or timed out.
   */
  public Duration getAcquisitionTime() { return acquisitionTime; }

  @Override
  public String toString() {
    return "ConnectionReport{requested=" + requested + ", poolSize=" + poolSize + ", acquired=" + acquired
        + ", established=" + established + ", acquisitionTime=" + acquisitionTime + "}";
  }
}
