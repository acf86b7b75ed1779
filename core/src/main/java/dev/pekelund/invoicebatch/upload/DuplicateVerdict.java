package dev.pekelund.invoicebatch.upload;

import java.util.Objects;

/**
 * Answer of a duplicate lookup for one fingerprint.
 */
public sealed interface DuplicateVerdict {

    default boolean isDuplicate() {
        return false;
    }

    static DuplicateVerdict none() {
        return NoDuplicate.INSTANCE;
    }

    record NoDuplicate() implements DuplicateVerdict {

        static final NoDuplicate INSTANCE = new NoDuplicate();
    }

    record SameUserDuplicate(String existingObjectName, String existingInvoiceId) implements DuplicateVerdict {

        @Override
        public boolean isDuplicate() {
            return true;
        }
    }

    record CrossUserDuplicate(CrossUserDuplicateInfo info) implements DuplicateVerdict {

        public CrossUserDuplicate {
            Objects.requireNonNull(info, "info");
        }

        @Override
        public boolean isDuplicate() {
            return true;
        }
    }

    /**
     * The lookup could not be answered. Treated as "no duplicate" so the upload continues.
     */
    record LookupFailedOpen(String reason) implements DuplicateVerdict {
    }
}
