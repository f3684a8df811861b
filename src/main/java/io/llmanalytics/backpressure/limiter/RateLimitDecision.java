package io.llmanalytics.backpressure.limiter;

/**
 * Outcome of a single rate limit check. Computed fresh per call, never persisted.
 *
 * remaining is 0 on a denial. On a fail-open admission it is the full limit.
 */
public final class RateLimitDecision {
  private final boolean allowed;
  private final int remaining;
  private final boolean failedOpen;

  private RateLimitDecision(boolean allowed, int remaining, boolean failedOpen) {
    this.allowed = allowed;
    this.remaining = remaining;
    this.failedOpen = failedOpen;
  }

  public static RateLimitDecision allow(int remaining) {
    return new RateLimitDecision(true, remaining, false);
  }

  public static RateLimitDecision deny() {
    return new RateLimitDecision(false, 0, false);
  }

  static RateLimitDecision failOpen(int limit) {
    return new RateLimitDecision(true, limit, true);
  }

  public boolean isAllowed() {
    return allowed;
  }

  public int getRemaining() {
    return remaining;
  }

  /**
   * True when the store could not be consulted and the request was admitted anyway.
   * Informational only: callers treat the decision like any other admission.
   */
  public boolean isFailedOpen() {
    return failedOpen;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof RateLimitDecision))
      return false;
    RateLimitDecision other = (RateLimitDecision) o;
    return allowed == other.allowed && remaining == other.remaining && failedOpen == other.failedOpen;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Boolean.hashCode(allowed) + remaining) + Boolean.hashCode(failedOpen);
  }

  @Override
  public String toString() {
    return "RateLimitDecision{allowed=" + allowed + ", remaining=" + remaining
        + (failedOpen ? ", failedOpen" : "") + "}";
  }
}
