package com.carbondna.api.verification;

import java.util.UUID;

public record RecordVerificationResult(
        UUID recordId,
        String partitionId,
        long sequence,
        boolean ok,
        TamperReason reason,
        String storedHash,
        String computedHash,
        String detail
) {

    static RecordVerificationResult valid(UUID recordId, String partitionId, long sequence, String hash) {
        return new RecordVerificationResult(recordId, partitionId, sequence, true, null, hash, hash, null);
    }

    static RecordVerificationResult mismatch(UUID recordId, String partitionId, long sequence,
                                             String storedHash, String computedHash, String detail) {
        return new RecordVerificationResult(recordId, partitionId, sequence, false,
                TamperReason.HASH_MISMATCH, storedHash, computedHash, detail);
    }
}
