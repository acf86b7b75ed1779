package dev.pekelund.invoicebatch.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import dev.pekelund.invoicebatch.invoice.InvoiceStatus;
import dev.pekelund.invoicebatch.optimistic.OptimisticOperation;
import dev.pekelund.invoicebatch.optimistic.RollbackNotification;
import dev.pekelund.invoicebatch.optimistic.RollbackReason;
import dev.pekelund.invoicebatch.upload.UploadProgress;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompositeProgressReporterTest {

    @Test
    void failingReporterDoesNotStopTheOthers() {
        ProgressReporter failing = mock(ProgressReporter.class);
        doThrow(new IllegalStateException("closed")).when(failing).onFileProgress(any());
        ProgressBoard board = new ProgressBoard();
        CompositeProgressReporter composite = new CompositeProgressReporter(List.of(failing, board));

        composite.onFileProgress(UploadProgress.preparing("a.pdf", "/a.pdf"));

        verify(failing).onFileProgress(any());
        assertThat(board.fileProgress("/a.pdf")).isPresent();
    }

    @Test
    void rollbacksReachEveryReporter() {
        ProgressBoard first = new ProgressBoard();
        ProgressBoard second = new ProgressBoard();
        CompositeProgressReporter composite = new CompositeProgressReporter(List.of(first, second));
        RollbackNotification notification = new RollbackNotification(
            new OptimisticOperation.StatusUpdate("invoice-1", InvoiceStatus.UNREIMBURSED, InvoiceStatus.REIMBURSED,
                Instant.EPOCH), RollbackReason.TIMED_OUT, null);

        composite.onRollback(notification);

        assertThat(first.recentRollbacks()).containsExactly(notification);
        assertThat(second.recentRollbacks()).containsExactly(notification);
        assertThat(composite.getDelegates()).containsExactly(first, second);
    }
}
