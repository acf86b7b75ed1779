package dev.pekelund.invoicebatch.upload;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

public class Sha256ContentHasher implements ContentHasher {

    private static final Pattern FINGERPRINT_PATTERN = Pattern.compile("^[a-f0-9]{64}$");

    @Override
    public String hash(byte[] content) {
        Objects.requireNonNull(content, "content");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    public static boolean isValidFingerprint(String fingerprint) {
        return fingerprint != null && FINGERPRINT_PATTERN.matcher(fingerprint).matches();
    }
}
