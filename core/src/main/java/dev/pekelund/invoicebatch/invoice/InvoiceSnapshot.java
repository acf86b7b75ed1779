package dev.pekelund.invoicebatch.invoice;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of an invoice as it is currently rendered. Optimistic operations keep the
 * snapshot taken before the change so it can be restored on rollback.
 */
public record InvoiceSnapshot(
    String id,
    String invoiceNumber,
    InvoiceStatus status,
    String sellerName,
    BigDecimal totalAmount,
    Instant updatedAt
) {

    public InvoiceSnapshot {
        Objects.requireNonNull(id, "id");
        status = status != null ? status : InvoiceStatus.UNREIMBURSED;
    }

    public InvoiceSnapshot withStatus(InvoiceStatus newStatus) {
        return new InvoiceSnapshot(id, invoiceNumber, newStatus, sellerName, totalAmount, updatedAt);
    }

    public InvoiceSnapshot withId(String newId) {
        return new InvoiceSnapshot(newId, invoiceNumber, status, sellerName, totalAmount, updatedAt);
    }
}
