package com.carbondna.api.canonical;

/**
 * Thrown when a payload cannot be serialized deterministically: unsupported
 * value types, non-finite numbers, ambiguous keys or reserved field names.
 * Signals a data-shape problem; the input is rejected, never retried.
 */
public class CanonicalizationException extends RuntimeException {

    public CanonicalizationException(String message) {
        super(message);
    }

    public CanonicalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
