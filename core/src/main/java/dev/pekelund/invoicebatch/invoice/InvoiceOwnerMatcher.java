package dev.pekelund.invoicebatch.invoice;

import org.springframework.util.StringUtils;

/**
 * Utility methods for comparing {@link InvoiceOwner} instances.
 */
public final class InvoiceOwnerMatcher {

    private InvoiceOwnerMatcher() {
    }

    /**
     * Determines whether the owner recorded on a stored invoice is the account currently uploading.
     * The id wins when both sides carry one; e-mail and display name are only consulted when an
     * id is missing on either side, so two different accounts sharing a display name never match.
     *
     * @param storedOwner  the owner recorded alongside the stored invoice
     * @param currentOwner the owner resolved from the current session
     * @return {@code true} if both represent the same account
     */
    public static boolean isSameOwner(InvoiceOwner storedOwner, InvoiceOwner currentOwner) {
        if (storedOwner == null || currentOwner == null) {
            return false;
        }

        if (StringUtils.hasText(storedOwner.id()) && StringUtils.hasText(currentOwner.id())) {
            return storedOwner.id().equals(currentOwner.id());
        }

        if (matchesIgnoreCase(storedOwner.email(), currentOwner.email())) {
            return true;
        }

        return matchesIgnoreCase(storedOwner.displayName(), currentOwner.displayName());
    }

    private static boolean matchesIgnoreCase(String left, String right) {
        return StringUtils.hasText(left) && StringUtils.hasText(right) && left.equalsIgnoreCase(right);
    }
}
