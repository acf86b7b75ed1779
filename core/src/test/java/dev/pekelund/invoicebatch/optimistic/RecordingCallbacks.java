package dev.pekelund.invoicebatch.optimistic;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingCallbacks implements MutationCallbacks {

    final List<List<OptimisticOperation>> applied = new CopyOnWriteArrayList<>();
    final List<List<OptimisticOperation>> confirmed = new CopyOnWriteArrayList<>();
    final List<List<OptimisticOperation>> rolledBack = new CopyOnWriteArrayList<>();
    final List<Throwable> causes = new CopyOnWriteArrayList<>();

    @Override
    public void onSuccess(List<OptimisticOperation> operations) {
        applied.add(operations);
    }

    @Override
    public void onError(List<OptimisticOperation> operations, Throwable cause) {
        rolledBack.add(operations);
        causes.add(cause);
    }

    @Override
    public void onConfirmed(List<OptimisticOperation> operations) {
        confirmed.add(operations);
    }
}
