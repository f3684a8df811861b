package io.llmanalytics.backpressure.loadtest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one operation a fixed number of times, strictly one call after another, timing each call.
 *
 * A call that throws is recorded as failed and the loop goes on, so one bad call never loses the
 * data of the remaining iterations. The loop only stops early when the thread is interrupted,
 * which is how the harness cancels a phase that ran out of time.
 */
public final class Worker {
    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final int index;

    public Worker(int index) {
        this.index = index;
    }

    public List<OperationResult> run(Operation operation, int iterations) {
        Objects.requireNonNull(operation, "operation");
        if (iterations < 0)
            throw new IllegalArgumentException("iterations < 0");

        List<OperationResult> results = new ArrayList<>(iterations);
        int failures = 0;
        for (int i = 0; i < iterations; i++) {
            if (Thread.currentThread().isInterrupted()) {
                logger.debug("Worker {} interrupted after {} of {} calls", index, i, iterations);
                break;
            }
            long start = System.nanoTime();
            try {
                boolean positive = operation.call();
                results.add(OperationResult.succeeded(System.nanoTime() - start, positive));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                results.add(OperationResult.failed());
                failures++;
            } catch (Exception ex) {
                results.add(OperationResult.failed());
                if (failures++ == 0)
                    logger.debug("Worker {} call {} failed", index, i, ex);
            }
        }
        if (failures > 0)
            logger.debug("Worker {} finished with {} failed calls out of {}", index, failures, results.size());
        return results;
    }
}
