package dev.pekelund.invoicebatch.invoice;

import java.util.List;
import java.util.Optional;

/**
 * Remote invoice store. Every method performs a network round trip and may throw
 * {@link InvoiceRepositoryException}.
 */
public interface InvoiceRepository {

    InvoiceRef create(NewInvoice invoice);

    void update(String invoiceId, InvoicePatch patch);

    /**
     * Apply the same status to several invoices in one remote call.
     */
    void updateStatuses(List<String> invoiceIds, InvoiceStatus status);

    void delete(String invoiceId);

    Optional<InvoiceSnapshot> findById(String invoiceId);
}
