package dev.pekelund.invoicebatch.optimistic;

import dev.pekelund.invoicebatch.invoice.InvoiceRef;
import java.util.concurrent.CompletableFuture;

/**
 * An optimistic create in flight. {@code invoice} completes with the server-assigned reference
 * that replaces {@code provisionalId}.
 */
public record PendingCreate(OperationKey key, String provisionalId, CompletableFuture<InvoiceRef> invoice) {
}
