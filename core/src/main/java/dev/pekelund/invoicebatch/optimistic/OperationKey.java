package dev.pekelund.invoicebatch.optimistic;

import java.util.Objects;

/**
 * Identity of a pending operation. The sequence keeps overlapping operations on the same entity
 * apart.
 */
public record OperationKey(OperationKind kind, String entityId, long sequence) {

    public OperationKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(entityId, "entityId");
    }

    @Override
    public String toString() {
        return kind + ":" + entityId + "#" + sequence;
    }
}
