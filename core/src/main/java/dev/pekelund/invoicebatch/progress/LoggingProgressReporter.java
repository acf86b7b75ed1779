package dev.pekelund.invoicebatch.progress;

import dev.pekelund.invoicebatch.optimistic.RollbackNotification;
import dev.pekelund.invoicebatch.upload.BatchProgress;
import dev.pekelund.invoicebatch.upload.BatchSummary;
import dev.pekelund.invoicebatch.upload.BatchUploadReport;
import dev.pekelund.invoicebatch.upload.UploadProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default reporter used when no UI is attached. Stage changes are logged at DEBUG, terminal
 * stages and rollbacks at INFO.
 */
public class LoggingProgressReporter implements ProgressReporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressReporter.class);

    @Override
    public void onFileProgress(UploadProgress progress) {
        if (progress.isTerminal()) {
            LOGGER.info("{} finished as {}: {}", progress.fileName(), progress.stage(), progress.statusText());
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} {} {}%", progress.fileName(), progress.stage(), Math.round(progress.progress() * 100));
        }
    }

    @Override
    public void onBatchProgress(BatchProgress progress) {
        LOGGER.debug("Batch {}: {}/{} file(s) done", progress.batchId(), progress.completedCount(),
            progress.totalCount());
    }

    @Override
    public void onBatchCompleted(BatchUploadReport report) {
        BatchSummary summary = report.summary();
        LOGGER.info("Batch {} complete: total={}, success={}, duplicate={}, failure={}, cancelled={}",
            report.batchId(), summary.totalCount(), summary.successCount(), summary.duplicateCount(),
            summary.failureCount(), summary.cancelledCount());
        if (summary.hasCrossUserDuplicate()) {
            LOGGER.info("Batch {} contains invoices already uploaded by another user", report.batchId());
        }
    }

    @Override
    public void onRollback(RollbackNotification notification) {
        LOGGER.info("Rolled back {} of {} ({})", notification.operation().kind(), notification.entityId(),
            notification.reason());
    }
}
