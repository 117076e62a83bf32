package com.carbondna.api.chain;

import java.util.UUID;

/**
 * Amendments form a linear history: only the latest revision of a record can
 * be amended.
 */
public class RecordAlreadySupersededException extends RuntimeException {

    public RecordAlreadySupersededException(UUID recordId) {
        super("Record " + recordId + " has already been superseded; amend its latest revision instead");
    }
}
