package com.carbondna.api.chain;

import java.util.UUID;

public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(UUID recordId) {
        super("Record not found: " + recordId);
    }
}
