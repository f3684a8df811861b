package io.llmanalytics.backpressure.loadtest;

/**
 * Builds the operation a worker will repeat. Called once per worker, on the worker's own thread,
 * so it is the place to obtain per-worker resources. Throwing here loses the whole worker.
 */
@FunctionalInterface
public interface OperationFactory {

    Operation create(int workerIndex) throws Exception;
}
