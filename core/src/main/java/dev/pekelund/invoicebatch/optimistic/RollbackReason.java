package dev.pekelund.invoicebatch.optimistic;

public enum RollbackReason {
    REMOTE_FAILURE,
    TIMED_OUT
}
