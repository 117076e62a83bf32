package com.carbondna.api.hashing;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Draws the per-record random salt.
 */
@Component
public class SaltGenerator {

    private final SecureRandom secureRandom;

    public SaltGenerator() {
        this.secureRandom = new SecureRandom();
    }

    /**
     * @return {@link RecordHasher#SALT_BYTES} random bytes as lowercase hex
     */
    public String nextSalt() {
        byte[] salt = new byte[RecordHasher.SALT_BYTES];
        secureRandom.nextBytes(salt);
        return HexFormat.of().formatHex(salt);
    }
}
