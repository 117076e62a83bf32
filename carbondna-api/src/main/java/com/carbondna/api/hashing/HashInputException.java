package com.carbondna.api.hashing;

/**
 * Thrown when hash input is malformed: a salt of the wrong length or
 * encoding, or a previous-hash reference that is not a SHA-256 hex digest.
 * Fatal for the write attempt that produced it.
 */
public class HashInputException extends RuntimeException {

    public HashInputException(String message) {
        super(message);
    }

    public HashInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
