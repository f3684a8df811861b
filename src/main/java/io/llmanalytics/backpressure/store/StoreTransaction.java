package io.llmanalytics.backpressure.store;

/**
 * Work executed against a single key while the store keeps that key isolated.
 */
@FunctionalInterface
public interface StoreTransaction<T> {

    T execute(TimeOrderedStore store) throws BackingStoreException;
}
