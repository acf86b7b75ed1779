package dev.pekelund.invoicebatch.optimistic;

import java.util.List;

/**
 * Hooks of the caller that owns the local state.
 */
public interface MutationCallbacks {

    /**
     * Apply the optimistic effect locally. Called synchronously before the server is contacted.
     */
    void onSuccess(List<OptimisticOperation> operations);

    /**
     * The server rejected the operations or they timed out; the local effect must be undone.
     */
    void onError(List<OptimisticOperation> operations, Throwable cause);

    /**
     * The server accepted the operations.
     */
    default void onConfirmed(List<OptimisticOperation> operations) {
    }
}
