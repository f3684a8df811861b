package io.llmanalytics.backpressure.store;

/**
 * Any failure reaching the backing store: timeout, lost connection, exhausted pool,
 * serialization problems.
 */
public class BackingStoreException extends Exception {

    public BackingStoreException(String message) {
        super(message);
    }

    public BackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
