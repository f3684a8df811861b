package io.llmanalytics.backpressure.loadtest;

/**
 * A worker could not start at all, e.g. it never obtained a connection. The worker contributes
 * no results and is counted as lost.
 */
public class WorkerFatalException extends RuntimeException {
    private final int workerIndex;

    public WorkerFatalException(int workerIndex, Throwable cause) {
        super("worker " + workerIndex + " failed during setup: " + cause, cause);
        this.workerIndex = workerIndex;
    }

    public int getWorkerIndex() {
        return workerIndex;
    }
}
