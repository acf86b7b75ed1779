package dev.pekelund.invoicebatch.invoice;

import java.util.Objects;

/**
 * Reference to a persisted invoice.
 */
public record InvoiceRef(String id, String invoiceNumber) {

    public InvoiceRef {
        Objects.requireNonNull(id, "id");
    }

    public InvoiceRef(String id) {
        this(id, null);
    }
}
