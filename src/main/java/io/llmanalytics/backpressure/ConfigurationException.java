package io.llmanalytics.backpressure;

/**
 * Invalid limiter or harness settings. Raised at call or build time and never retried.
 */
public class ConfigurationException extends IllegalArgumentException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
