package dev.pekelund.invoicebatch.firestore;

import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.WriteBatch;
import dev.pekelund.invoicebatch.invoice.ExtractedInvoice;
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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Persists invoices as documents in a single Firestore collection.
 */
public class FirestoreInvoiceRepository implements InvoiceRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreInvoiceRepository.class);

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreInvoiceRepository(Firestore firestore, String collectionName) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        LOGGER.info("FirestoreInvoiceRepository initialized with collection '{}'", collectionName);
    }

    @Override
    public InvoiceRef create(NewInvoice invoice) {
        ExtractedInvoice extracted = invoice.extracted();
        Timestamp now = Timestamp.now();

        Map<String, Object> payload = new HashMap<>();
        InvoiceOwner owner = invoice.owner();
        if (owner != null && owner.hasValues()) {
            payload.put("owner", owner.toAttributes());
        }
        payload.put("data", extracted.fields());
        putIfPresent(payload, "invoiceNumber", extracted.invoiceNumber());
        putIfPresent(payload, "sellerName", extracted.sellerName());
        BigDecimal totalAmount = extracted.totalAmount();
        if (totalAmount != null) {
            payload.put("totalAmount", totalAmount.toPlainString());
        }
        payload.put("status", InvoiceStatus.UNREIMBURSED.name());
        putIfPresent(payload, "contentSha256", invoice.contentFingerprint());
        putIfPresent(payload, "objectPath", invoice.storedObjectPath());
        payload.put("createdAt", now);
        payload.put("updatedAt", now);

        DocumentReference document = firestore.collection(collectionName).document();
        await(document.set(payload), "create invoice " + document.getId());
        LOGGER.info("Created invoice document {}/{}", collectionName, document.getId());
        return new InvoiceRef(document.getId(), extracted.invoiceNumber());
    }

    @Override
    public void update(String invoiceId, InvoicePatch patch) {
        Assert.hasText(invoiceId, "invoiceId must not be empty");
        if (patch == null || patch.isEmpty()) {
            return;
        }

        Map<String, Object> fields = new HashMap<>(patch.toFields());
        fields.put("updatedAt", Timestamp.now());
        await(document(invoiceId).update(fields), "update invoice " + invoiceId);
        LOGGER.info("Updated invoice {}/{} fields {}", collectionName, invoiceId, fields.keySet());
    }

    @Override
    public void updateStatuses(List<String> invoiceIds, InvoiceStatus status) {
        Objects.requireNonNull(status, "status");
        if (invoiceIds == null || invoiceIds.isEmpty()) {
            return;
        }

        Timestamp now = Timestamp.now();
        WriteBatch batch = firestore.batch();
        for (String invoiceId : new LinkedHashSet<>(invoiceIds)) {
            Assert.hasText(invoiceId, "invoiceId must not be empty");
            Map<String, Object> fields = new HashMap<>();
            fields.put("status", status.name());
            fields.put("updatedAt", now);
            batch.update(document(invoiceId), fields);
        }
        await(batch.commit(), "update status of " + invoiceIds.size() + " invoices");
        LOGGER.info("Set status {} on {} invoice(s) in {}", status, invoiceIds.size(), collectionName);
    }

    @Override
    public void delete(String invoiceId) {
        Assert.hasText(invoiceId, "invoiceId must not be empty");
        await(document(invoiceId).delete(), "delete invoice " + invoiceId);
        LOGGER.info("Deleted invoice {}/{}", collectionName, invoiceId);
    }

    @Override
    public Optional<InvoiceSnapshot> findById(String invoiceId) {
        if (!StringUtils.hasText(invoiceId)) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = await(document(invoiceId).get(), "read invoice " + invoiceId);
        if (snapshot == null || !snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.of(toSnapshot(snapshot));
    }

    private InvoiceSnapshot toSnapshot(DocumentSnapshot snapshot) {
        Timestamp updatedAt = snapshot.getTimestamp("updatedAt");
        return new InvoiceSnapshot(
            snapshot.getId(),
            snapshot.getString("invoiceNumber"),
            InvoiceStatus.fromValue(snapshot.getString("status")),
            snapshot.getString("sellerName"),
            toBigDecimal(snapshot.get("totalAmount")),
            updatedAt != null ? Instant.ofEpochSecond(updatedAt.getSeconds(), updatedAt.getNanos()) : null);
    }

    private DocumentReference document(String invoiceId) {
        return firestore.collection(collectionName).document(invoiceId);
    }

    private <T> T await(ApiFuture<T> future, String action) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            LOGGER.error("Interrupted while trying to {} in {}", action, collectionName, ex);
            Thread.currentThread().interrupt();
            throw new InvoiceRepositoryException("Interrupted while trying to " + action, ex);
        } catch (ExecutionException ex) {
            LOGGER.error("Failed to {} in {}", action, collectionName, ex);
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new InvoiceRepositoryException("Failed to " + action + ": " + cause.getMessage(), cause);
        }
    }

    private static void putIfPresent(Map<String, Object> payload, String key, String value) {
        if (StringUtils.hasText(value)) {
            payload.put(key, value);
        }
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && StringUtils.hasText(text)) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                LOGGER.debug("Ignoring non-numeric totalAmount '{}'", text);
            }
        }
        return null;
    }
}
