package dev.pekelund.invoicebatch.progress;

import dev.pekelund.invoicebatch.optimistic.RollbackNotification;
import dev.pekelund.invoicebatch.upload.BatchProgress;
import dev.pekelund.invoicebatch.upload.BatchUploadReport;
import dev.pekelund.invoicebatch.upload.UploadProgress;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans every event out to several reporters. A failing reporter does not stop the others.
 */
public class CompositeProgressReporter implements ProgressReporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompositeProgressReporter.class);

    private final List<ProgressReporter> delegates;

    public CompositeProgressReporter(List<? extends ProgressReporter> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public List<ProgressReporter> getDelegates() {
        return delegates;
    }

    @Override
    public void onFileProgress(UploadProgress progress) {
        forEach(reporter -> reporter.onFileProgress(progress));
    }

    @Override
    public void onBatchProgress(BatchProgress progress) {
        forEach(reporter -> reporter.onBatchProgress(progress));
    }

    @Override
    public void onBatchCompleted(BatchUploadReport report) {
        forEach(reporter -> reporter.onBatchCompleted(report));
    }

    @Override
    public void onRollback(RollbackNotification notification) {
        forEach(reporter -> reporter.onRollback(notification));
    }

    private void forEach(Consumer<ProgressReporter> event) {
        for (ProgressReporter delegate : delegates) {
            try {
                event.accept(delegate);
            } catch (RuntimeException ex) {
                LOGGER.warn("Progress reporter {} failed", delegate.getClass().getName(), ex);
            }
        }
    }
}
