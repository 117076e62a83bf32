package com.carbondna.api.ledger;

import com.carbondna.core.domain.LedgerRecord;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Record as returned by the API: stored hashes and salt, the hashed payload
 * as an object and the current quality annotation.
 */
public record RecordView(
        UUID id,
        String partitionId,
        long sequence,
        Map<String, Object> payload,
        String salt,
        String previousHash,
        String recordHash,
        Instant createdAt,
        UUID supersedesId,
        Map<String, Object> annotation
) {

    static RecordView of(LedgerRecord record, Map<String, Object> payload, Map<String, Object> annotation) {
        return new RecordView(
                record.getId(),
                record.getPartitionId(),
                record.getSequence(),
                payload,
                record.getSalt(),
                record.getPreviousHash(),
                record.getRecordHash(),
                record.getCreatedAt(),
                record.getSupersedesId(),
                annotation);
    }
}
