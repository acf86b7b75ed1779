package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates MDC entries so log lines emitted while a batch or a single file is processed share
 * the same identifiers (batch id, file, stage, owner).
 */
final class UploadJobMdc {

    static final String KEY_BATCH_ID = "invoice.batchId";
    static final String KEY_FILE = "invoice.file";
    static final String KEY_STAGE = "invoice.stage";
    static final String KEY_OWNER_ID = "invoice.ownerId";

    private UploadJobMdc() {
        // Utility class
    }

    static Context open(String batchId) {
        return new Context(batchId);
    }

    static void attachFile(String filePath) {
        putIfHasText(KEY_FILE, filePath);
    }

    static void attachOwner(InvoiceOwner owner) {
        putIfHasText(KEY_OWNER_ID, owner != null ? owner.id() : null);
    }

    static void setStage(UploadStage stage) {
        putIfHasText(KEY_STAGE, stage != null ? stage.name() : null);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String batchId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_BATCH_ID, batchId);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
