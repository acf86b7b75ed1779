package dev.pekelund.invoicebatch.optimistic;

import java.time.Duration;

/**
 * Handed to {@link MutationCallbacks#onError} when the server did not answer in time.
 */
public class OptimisticOperationTimeoutException extends RuntimeException {

    private final transient OperationKey key;

    public OptimisticOperationTimeoutException(OperationKey key, Duration timeout) {
        super("Operation " + key + " was not confirmed within " + timeout);
        this.key = key;
    }

    public OperationKey getKey() {
        return key;
    }
}
