package io.octavecanon.core.repair;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 digests of literal zone content, as used in preservation receipts. */
public final class ContentHash {

    private static final String PREFIX = "sha256:";

    private ContentHash() {
        // utility class
    }

    /** {@code sha256:} followed by the lowercase hex digest of the UTF-8 bytes. */
    public static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return PREFIX + HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
