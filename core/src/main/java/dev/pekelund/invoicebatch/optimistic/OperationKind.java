package dev.pekelund.invoicebatch.optimistic;

public enum OperationKind {
    STATUS_UPDATE,
    DELETE,
    BATCH_STATUS_UPDATE,
    CREATE,
    UPDATE
}
