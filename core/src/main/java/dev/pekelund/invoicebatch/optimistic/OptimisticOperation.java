package dev.pekelund.invoicebatch.optimistic;

import dev.pekelund.invoicebatch.invoice.InvoiceSnapshot;
import dev.pekelund.invoicebatch.invoice.InvoiceStatus;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A local mutation that has been applied to the UI before the server confirmed it. Each variant
 * keeps the state needed to undo it.
 */
public sealed interface OptimisticOperation {

    String PROVISIONAL_ID_PREFIX = "pending-";

    String entityId();

    Instant createdAt();

    OperationKind kind();

    static String provisionalId() {
        return PROVISIONAL_ID_PREFIX + UUID.randomUUID();
    }

    record StatusUpdate(String entityId, InvoiceStatus original, InvoiceStatus updated, Instant createdAt)
        implements OptimisticOperation {

        public StatusUpdate {
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(original, "original");
            Objects.requireNonNull(updated, "updated");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.STATUS_UPDATE;
        }
    }

    record Delete(String entityId, InvoiceSnapshot original, Instant createdAt) implements OptimisticOperation {

        public Delete {
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(original, "original");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.DELETE;
        }
    }

    record BatchStatusUpdate(String entityId, String batchId, InvoiceStatus original, InvoiceStatus updated,
        Instant createdAt) implements OptimisticOperation {

        public BatchStatusUpdate {
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(batchId, "batchId");
            Objects.requireNonNull(original, "original");
            Objects.requireNonNull(updated, "updated");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.BATCH_STATUS_UPDATE;
        }
    }

    /**
     * An invoice shown before the server assigned its id. There is no original state: rolling
     * back removes the provisional entry.
     */
    record Create(String entityId, InvoiceSnapshot created, Instant createdAt) implements OptimisticOperation {

        public Create {
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(created, "created");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.CREATE;
        }
    }

    record Update(String entityId, InvoiceSnapshot original, InvoiceSnapshot updated, Instant createdAt)
        implements OptimisticOperation {

        public Update {
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(original, "original");
            Objects.requireNonNull(updated, "updated");
        }

        @Override
        public OperationKind kind() {
            return OperationKind.UPDATE;
        }
    }
}
