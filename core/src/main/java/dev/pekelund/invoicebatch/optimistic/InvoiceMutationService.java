package dev.pekelund.invoicebatch.optimistic;

import dev.pekelund.invoicebatch.invoice.ExtractedInvoice;
import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import dev.pekelund.invoicebatch.invoice.InvoicePatch;
import dev.pekelund.invoicebatch.invoice.InvoiceRef;
import dev.pekelund.invoicebatch.invoice.InvoiceRepository;
import dev.pekelund.invoicebatch.invoice.InvoiceSnapshot;
import dev.pekelund.invoicebatch.invoice.InvoiceStatus;
import dev.pekelund.invoicebatch.invoice.NewInvoice;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Invoice edits applied optimistically and confirmed against the {@link InvoiceRepository}.
 */
public class InvoiceMutationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceMutationService.class);

    private final OptimisticMutationCoordinator coordinator;
    private final InvoiceRepository repository;
    private final Clock clock;

    public InvoiceMutationService(OptimisticMutationCoordinator coordinator, InvoiceRepository repository,
        Clock clock) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return the pending operation, or empty if the invoice already has {@code status}
     */
    public Optional<OperationKey> changeStatus(InvoiceSnapshot invoice, InvoiceStatus status,
        MutationCallbacks callbacks) {
        Objects.requireNonNull(invoice, "invoice");
        Objects.requireNonNull(status, "status");
        if (invoice.status() == status) {
            LOGGER.debug("Invoice {} already has status {}", invoice.id(), status);
            return Optional.empty();
        }

        OptimisticOperation operation =
            new OptimisticOperation.StatusUpdate(invoice.id(), invoice.status(), status, now());
        return Optional.of(coordinator.apply(operation,
            () -> repository.update(invoice.id(), InvoicePatch.status(status)), callbacks));
    }

    public OperationKey update(InvoiceSnapshot invoice, InvoicePatch patch, MutationCallbacks callbacks) {
        Objects.requireNonNull(invoice, "invoice");
        Assert.isTrue(patch != null && !patch.isEmpty(), "Patch must change at least one field");

        OptimisticOperation operation =
            new OptimisticOperation.Update(invoice.id(), invoice, patch.applyTo(invoice), now());
        return coordinator.apply(operation, () -> repository.update(invoice.id(), patch), callbacks);
    }

    public OperationKey delete(InvoiceSnapshot invoice, MutationCallbacks callbacks) {
        Objects.requireNonNull(invoice, "invoice");
        OptimisticOperation operation = new OptimisticOperation.Delete(invoice.id(), invoice, now());
        return coordinator.apply(operation, () -> repository.delete(invoice.id()), callbacks);
    }

    /**
     * Change the status of several invoices with a single server call. Invoices that already have
     * {@code status} are left out; if the call fails every remaining invoice is rolled back.
     */
    public List<OperationKey> changeStatuses(List<InvoiceSnapshot> invoices, InvoiceStatus status,
        MutationCallbacks callbacks) {
        Objects.requireNonNull(status, "status");
        if (invoices == null || invoices.isEmpty()) {
            return List.of();
        }

        String batchId = UUID.randomUUID().toString();
        Instant createdAt = now();
        List<OptimisticOperation> operations = new ArrayList<>();
        List<String> invoiceIds = new ArrayList<>();
        for (InvoiceSnapshot invoice : invoices) {
            if (invoice.status() == status) {
                continue;
            }
            operations.add(new OptimisticOperation.BatchStatusUpdate(invoice.id(), batchId, invoice.status(), status,
                createdAt));
            invoiceIds.add(invoice.id());
        }
        if (operations.isEmpty()) {
            LOGGER.debug("All {} invoice(s) already have status {}", invoices.size(), status);
            return List.of();
        }

        LOGGER.info("Changing status of {} invoice(s) to {} in batch {}", invoiceIds.size(), status, batchId);
        List<String> ids = List.copyOf(invoiceIds);
        return coordinator.applyBatch(operations, () -> repository.updateStatuses(ids, status), callbacks);
    }

    /**
     * Show {@code draft} under a provisional id until the server has created the invoice.
     */
    public PendingCreate create(InvoiceOwner owner, InvoiceSnapshot draft, MutationCallbacks callbacks) {
        Objects.requireNonNull(draft, "draft");
        String provisionalId = OptimisticOperation.provisionalId();
        InvoiceSnapshot provisional = draft.withId(provisionalId);
        NewInvoice newInvoice = new NewInvoice(owner, new ExtractedInvoice(fieldsOf(provisional)), null, null);

        CompletableFuture<InvoiceRef> created = new CompletableFuture<>();
        RemoteMutation call = () -> {
            try {
                created.complete(repository.create(newInvoice));
            } catch (RuntimeException ex) {
                created.completeExceptionally(ex);
                throw ex;
            }
        };

        OperationKey key = coordinator.apply(new OptimisticOperation.Create(provisionalId, provisional, now()), call,
            callbacks);
        return new PendingCreate(key, provisionalId, created);
    }

    private static Map<String, Object> fieldsOf(InvoiceSnapshot snapshot) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (snapshot.invoiceNumber() != null) {
            fields.put(ExtractedInvoice.FIELD_INVOICE_NUMBER, snapshot.invoiceNumber());
        }
        if (snapshot.sellerName() != null) {
            fields.put(ExtractedInvoice.FIELD_SELLER_NAME, snapshot.sellerName());
        }
        if (snapshot.totalAmount() != null) {
            fields.put(ExtractedInvoice.FIELD_TOTAL_AMOUNT, snapshot.totalAmount());
        }
        return fields;
    }

    private Instant now() {
        return clock.instant();
    }
}
