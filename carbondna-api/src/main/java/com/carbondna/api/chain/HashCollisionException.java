package com.carbondna.api.chain;

/**
 * A freshly computed record hash already exists in the ledger.
 * Fatal integrity error; never retried or ignored.
 */
public class HashCollisionException extends RuntimeException {

    public HashCollisionException(String partitionId, String recordHash) {
        super("Record hash " + recordHash + " computed for partition '" + partitionId + "' already exists");
    }
}
