package com.carbondna.api.verification;

import java.util.UUID;

/**
 * What-if result: the hash a record would have needed after one field change.
 * Nothing is written.
 */
public record TamperSimulation(
        UUID recordId,
        String field,
        Object originalValue,
        Object tamperedValue,
        String storedHash,
        String tamperedHash,
        boolean integrityBroken
) {}
