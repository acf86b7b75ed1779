package dev.pekelund.invoicebatch.upload;

import java.time.Instant;
import java.util.List;

/**
 * Disclosure payload for a file whose content is already owned by another account.
 */
public record CrossUserDuplicateInfo(
    String invoiceNumber,
    String originalUserEmail,
    Instant uploadedAt,
    double similarityScore,
    List<String> recommendations
) {

    public CrossUserDuplicateInfo {
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    /**
     * E-mail of the other account with the local part masked, e.g. {@code jo***n@example.com}.
     */
    public String maskedOriginalUserEmail() {
        if (originalUserEmail == null || originalUserEmail.isBlank()) {
            return null;
        }
        int at = originalUserEmail.indexOf('@');
        if (at < 0) {
            return "***";
        }
        String username = originalUserEmail.substring(0, at);
        String domain = originalUserEmail.substring(at + 1);
        if (username.length() <= 2) {
            return username + "***@" + domain;
        }
        return username.substring(0, 2) + "***" + username.substring(username.length() - 1) + "@" + domain;
    }
}
