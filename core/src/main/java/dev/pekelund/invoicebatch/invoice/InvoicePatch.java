package dev.pekelund.invoicebatch.invoice;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of an invoice. {@code null} fields are left untouched.
 */
public record InvoicePatch(
    InvoiceStatus status,
    String invoiceNumber,
    String sellerName,
    BigDecimal totalAmount
) {

    public static InvoicePatch status(InvoiceStatus status) {
        return new InvoicePatch(status, null, null, null);
    }

    public boolean isEmpty() {
        return status == null && invoiceNumber == null && sellerName == null && totalAmount == null;
    }

    public InvoiceSnapshot applyTo(InvoiceSnapshot snapshot) {
        return new InvoiceSnapshot(
            snapshot.id(),
            invoiceNumber != null ? invoiceNumber : snapshot.invoiceNumber(),
            status != null ? status : snapshot.status(),
            sellerName != null ? sellerName : snapshot.sellerName(),
            totalAmount != null ? totalAmount : snapshot.totalAmount(),
            snapshot.updatedAt());
    }

    /**
     * Field map suitable for a document store update; only populated fields are present.
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (status != null) {
            fields.put("status", status.name());
        }
        if (invoiceNumber != null) {
            fields.put("invoiceNumber", invoiceNumber);
        }
        if (sellerName != null) {
            fields.put("sellerName", sellerName);
        }
        if (totalAmount != null) {
            fields.put("totalAmount", totalAmount.toPlainString());
        }
        return fields;
    }
}
