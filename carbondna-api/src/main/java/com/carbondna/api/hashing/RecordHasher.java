package com.carbondna.api.hashing;

import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes record identity hashes.
 *
 * <pre>
 * record_hash = SHA-256( canonical_payload || salt || previous_hash )
 * </pre>
 *
 * The salt (16 bytes) and the previous hash (32 bytes) enter the digest as raw
 * bytes decoded from their hex form, after the canonical payload bytes. Both
 * have fixed lengths, so the concatenation is unambiguous. The result is
 * rendered as 64 lowercase hex characters.
 */
@Component
public class RecordHasher {

    public static final String ALGORITHM = "SHA-256";
    public static final int SALT_BYTES = 16;
    public static final int HASH_BYTES = 32;

    private static final HexFormat HEX = HexFormat.of();

    public String hash(byte[] canonicalPayload, String salt, String previousHash) {
        if (canonicalPayload == null) {
            throw new HashInputException("Canonical payload cannot be null");
        }
        byte[] saltBytes = decode("salt", salt, SALT_BYTES);
        byte[] previousBytes = decode("previous hash", previousHash, HASH_BYTES);

        MessageDigest digest = newDigest();
        digest.update(canonicalPayload);
        digest.update(saltBytes);
        digest.update(previousBytes);
        return HEX.formatHex(digest.digest());
    }

    private static byte[] decode(String name, String hex, int expectedBytes) {
        if (hex == null) {
            throw new HashInputException("Missing " + name);
        }
        if (hex.length() != expectedBytes * 2) {
            throw new HashInputException("Invalid " + name + " length: expected "
                    + expectedBytes * 2 + " hex characters, got " + hex.length());
        }
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if (!(c >= '0' && c <= '9') && !(c >= 'a' && c <= 'f')) {
                throw new HashInputException("Invalid " + name + " encoding: not lowercase hex");
            }
        }
        return HEX.parseHex(hex);
    }

    /**
     * SHA-256 of arbitrary bytes as lowercase hex.
     */
    public static String sha256Hex(byte[] input) {
        return HEX.formatHex(newDigest().digest(input));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
