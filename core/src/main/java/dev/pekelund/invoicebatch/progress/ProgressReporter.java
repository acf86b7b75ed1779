package dev.pekelund.invoicebatch.progress;

import dev.pekelund.invoicebatch.optimistic.RollbackListener;
import dev.pekelund.invoicebatch.optimistic.RollbackNotification;
import dev.pekelund.invoicebatch.upload.UploadProgressListener;

/**
 * Push interface handed to the presentation layer. It receives upload progress of every batch
 * and every optimistic rollback. Calls arrive on background threads.
 */
public interface ProgressReporter extends UploadProgressListener, RollbackListener {

    @Override
    default void onRollback(RollbackNotification notification) {
    }
}
