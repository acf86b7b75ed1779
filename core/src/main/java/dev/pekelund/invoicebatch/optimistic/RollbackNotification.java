package dev.pekelund.invoicebatch.optimistic;

import java.util.Objects;

/**
 * Tells the UI layer to restore the state captured in {@code operation}.
 */
public record RollbackNotification(OptimisticOperation operation, RollbackReason reason, Throwable cause) {

    public RollbackNotification {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(reason, "reason");
    }

    public String entityId() {
        return operation.entityId();
    }
}
