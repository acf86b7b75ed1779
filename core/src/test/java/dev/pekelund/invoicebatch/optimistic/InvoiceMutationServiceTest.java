package dev.pekelund.invoicebatch.optimistic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import dev.pekelund.invoicebatch.invoice.InvoicePatch;
import dev.pekelund.invoicebatch.invoice.InvoiceRef;
import dev.pekelund.invoicebatch.invoice.InvoiceRepository;
import dev.pekelund.invoicebatch.invoice.InvoiceRepositoryException;
import dev.pekelund.invoicebatch.invoice.InvoiceSnapshot;
import dev.pekelund.invoicebatch.invoice.InvoiceStatus;
import dev.pekelund.invoicebatch.invoice.NewInvoice;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class InvoiceMutationServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");
    private static final InvoiceOwner OWNER = new InvoiceOwner("user-1", "Anna", "anna@example.com");

    private InvoiceRepository repository;
    private List<RollbackNotification> rollbacks;
    private RecordingCallbacks callbacks;
    private InvoiceMutationService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        repository = mock(InvoiceRepository.class);
        rollbacks = new CopyOnWriteArrayList<>();
        callbacks = new RecordingCallbacks();
        OptimisticMutationCoordinator coordinator = new OptimisticMutationCoordinator(new OptimisticProperties(),
            Runnable::run, null, clock, rollbacks::add);
        service = new InvoiceMutationService(coordinator, repository, clock);
    }

    @Test
    void unchangedStatusIsANoOp() {
        Optional<OperationKey> key = service.changeStatus(invoice("invoice-1"), InvoiceStatus.UNREIMBURSED, callbacks);

        assertThat(key).isEmpty();
        assertThat(callbacks.applied).isEmpty();
        verifyNoInteractions(repository);
    }

    @Test
    void statusChangeIsConfirmedByTheRepository() {
        Optional<OperationKey> key = service.changeStatus(invoice("invoice-1"), InvoiceStatus.REIMBURSED, callbacks);

        assertThat(key).isPresent();
        verify(repository).update("invoice-1", InvoicePatch.status(InvoiceStatus.REIMBURSED));
        assertThat(callbacks.confirmed).hasSize(1);
        assertThat(rollbacks).isEmpty();
    }

    @Test
    void rejectedStatusChangeRestoresPreviousStatus() {
        doThrow(new InvoiceRepositoryException("permission denied"))
            .when(repository).update(eq("invoice-1"), any());

        service.changeStatus(invoice("invoice-1"), InvoiceStatus.REIMBURSED, callbacks);

        assertThat(rollbacks).hasSize(1);
        OptimisticOperation.StatusUpdate rolledBack = (OptimisticOperation.StatusUpdate) rollbacks.get(0).operation();
        assertThat(rolledBack.original()).isEqualTo(InvoiceStatus.UNREIMBURSED);
        assertThat(rolledBack.updated()).isEqualTo(InvoiceStatus.REIMBURSED);
        assertThat(callbacks.causes.get(0)).isInstanceOf(InvoiceRepositoryException.class);
    }

    @Test
    void updateKeepsOriginalAndPatchedSnapshots() {
        InvoiceSnapshot original = invoice("invoice-1");
        InvoicePatch patch = new InvoicePatch(null, null, "ACME Nordic AB", null);

        service.update(original, patch, callbacks);

        OptimisticOperation.Update applied = (OptimisticOperation.Update) callbacks.applied.get(0).get(0);
        assertThat(applied.original()).isEqualTo(original);
        assertThat(applied.updated().sellerName()).isEqualTo("ACME Nordic AB");
        assertThat(applied.updated().totalAmount()).isEqualTo(original.totalAmount());
        verify(repository).update("invoice-1", patch);
    }

    @Test
    void emptyPatchIsRejected() {
        assertThatThrownBy(() -> service.update(invoice("invoice-1"), new InvoicePatch(null, null, null, null),
            callbacks)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(repository);
    }

    @Test
    void failedDeleteHandsBackTheDeletedInvoice() {
        InvoiceSnapshot original = invoice("invoice-1");
        doThrow(new InvoiceRepositoryException("unavailable")).when(repository).delete("invoice-1");

        service.delete(original, callbacks);

        assertThat(rollbacks).hasSize(1);
        assertThat(((OptimisticOperation.Delete) rollbacks.get(0).operation()).original()).isEqualTo(original);
    }

    @Test
    void batchStatusChangeSkipsUnchangedInvoicesAndUsesOneCall() {
        InvoiceSnapshot first = invoice("invoice-1");
        InvoiceSnapshot alreadyReimbursed = invoice("invoice-2").withStatus(InvoiceStatus.REIMBURSED);
        InvoiceSnapshot third = invoice("invoice-3");

        List<OperationKey> keys = service.changeStatuses(List.of(first, alreadyReimbursed, third),
            InvoiceStatus.REIMBURSED, callbacks);

        assertThat(keys).extracting(OperationKey::entityId).containsExactly("invoice-1", "invoice-3");
        verify(repository).updateStatuses(List.of("invoice-1", "invoice-3"), InvoiceStatus.REIMBURSED);
        assertThat(callbacks.confirmed).hasSize(1);
    }

    @Test
    void failedBatchStatusChangeRollsBackEveryInvoice() {
        doThrow(new InvoiceRepositoryException("unavailable")).when(repository).updateStatuses(anyList(), any());

        service.changeStatuses(List.of(invoice("invoice-1"), invoice("invoice-2")), InvoiceStatus.REIMBURSED,
            callbacks);

        assertThat(rollbacks).extracting(RollbackNotification::entityId).containsExactly("invoice-1", "invoice-2");
        assertThat(rollbacks.stream()
            .map(notification -> ((OptimisticOperation.BatchStatusUpdate) notification.operation()).batchId())
            .distinct()).hasSize(1);
        assertThat(callbacks.rolledBack).hasSize(1);
    }

    @Test
    void batchWithNothingToChangeDoesNotCallTheServer() {
        List<OperationKey> keys = service.changeStatuses(
            List.of(invoice("invoice-1").withStatus(InvoiceStatus.REIMBURSED)), InvoiceStatus.REIMBURSED, callbacks);

        assertThat(keys).isEmpty();
        verifyNoInteractions(repository);
    }

    @Test
    void createShowsProvisionalIdUntilTheServerAssignsOne() {
        when(repository.create(any())).thenReturn(new InvoiceRef("invoice-42", "INV-42"));
        InvoiceSnapshot draft = new InvoiceSnapshot("draft", "INV-42", null, "ACME AB", new BigDecimal("125.00"), NOW);

        PendingCreate pending = service.create(OWNER, draft, callbacks);

        assertThat(pending.provisionalId()).startsWith(OptimisticOperation.PROVISIONAL_ID_PREFIX);
        assertThat(pending.invoice()).isCompletedWithValue(new InvoiceRef("invoice-42", "INV-42"));
        OptimisticOperation.Create created = (OptimisticOperation.Create) callbacks.applied.get(0).get(0);
        assertThat(created.created().id()).isEqualTo(pending.provisionalId());

        ArgumentCaptor<NewInvoice> captor = ArgumentCaptor.forClass(NewInvoice.class);
        verify(repository).create(captor.capture());
        assertThat(captor.getValue().owner()).isEqualTo(OWNER);
        assertThat(captor.getValue().extracted().invoiceNumber()).isEqualTo("INV-42");
        assertThat(captor.getValue().extracted().sellerName()).isEqualTo("ACME AB");
    }

    @Test
    void failedCreateRemovesTheProvisionalInvoice() {
        when(repository.create(any())).thenThrow(new InvoiceRepositoryException("unavailable"));

        PendingCreate pending = service.create(OWNER, invoice("draft"), callbacks);

        assertThat(pending.invoice()).isCompletedExceptionally();
        assertThat(rollbacks).extracting(RollbackNotification::entityId).containsExactly(pending.provisionalId());
    }

    private static InvoiceSnapshot invoice(String id) {
        return new InvoiceSnapshot(id, "INV-" + id, InvoiceStatus.UNREIMBURSED, "ACME AB", new BigDecimal("99.50"),
            NOW);
    }
}
