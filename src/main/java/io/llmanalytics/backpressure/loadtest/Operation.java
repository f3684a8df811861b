package io.llmanalytics.backpressure.loadtest;

/**
 * One call against the system under test.
 *
 * The return value is the call's outcome: true for a hit or an admission, false for a miss or a
 * denial. Operations with no such notion return true. Throwing marks the call as failed.
 */
@FunctionalInterface
public interface Operation {

    boolean call() throws Exception;
}
