package dev.pekelund.invoicebatch.optimistic;

@FunctionalInterface
public interface RollbackListener {

    RollbackListener NONE = notification -> { };

    void onRollback(RollbackNotification notification);
}
