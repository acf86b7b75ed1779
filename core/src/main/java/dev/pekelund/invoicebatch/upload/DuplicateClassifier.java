package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies a fingerprint against the remote index. A lookup that throws or answers nothing
 * fails open: the file is uploaded without duplicate protection.
 */
public class DuplicateClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateClassifier.class);

    private final DuplicateLookupService lookupService;

    public DuplicateClassifier(DuplicateLookupService lookupService) {
        this.lookupService = Objects.requireNonNull(lookupService, "lookupService");
    }

    public DuplicateVerdict classify(String fingerprint, InvoiceOwner owner) {
        DuplicateVerdict verdict;
        try {
            verdict = lookupService.lookup(fingerprint, owner);
        } catch (RuntimeException ex) {
            LOGGER.warn("Duplicate lookup failed for fingerprint {}; continuing without duplicate protection",
                abbreviate(fingerprint), ex);
            return new DuplicateVerdict.LookupFailedOpen(ex.getMessage());
        }

        if (verdict == null) {
            LOGGER.warn("Duplicate lookup returned no verdict for fingerprint {}; continuing without duplicate protection",
                abbreviate(fingerprint));
            return new DuplicateVerdict.LookupFailedOpen("No verdict returned");
        }

        if (verdict.isDuplicate()) {
            LOGGER.info("Fingerprint {} matched an existing upload ({})", abbreviate(fingerprint),
                verdict.getClass().getSimpleName());
        }
        return verdict;
    }

    private static String abbreviate(String fingerprint) {
        if (fingerprint == null || fingerprint.length() <= 12) {
            return fingerprint;
        }
        return fingerprint.substring(0, 12);
    }
}
