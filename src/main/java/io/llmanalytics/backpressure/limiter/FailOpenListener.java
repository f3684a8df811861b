package io.llmanalytics.backpressure.limiter;

/**
 * Out-of-band sink for fail-open occurrences. Called on the request path, so implementations
 * should be cheap and must not throw.
 */
@FunctionalInterface
public interface FailOpenListener {

  void onFailOpen(FailOpenEvent event);
}
