package com.carbondna.api.verification;

import java.util.UUID;

/**
 * Outcome of walking a range of a partition's chain. On failure,
 * {@code firstBrokenRecordId} is the earliest record that fails its check and
 * {@code reason} is always {@link TamperReason#CHAIN_BREAK}.
 * {@code recordReason} tells what failed at that record: its link to the
 * predecessor ({@code CHAIN_BREAK}) or its own recomputed hash
 * ({@code HASH_MISMATCH}).
 */
public record ChainVerificationResult(
        String partitionId,
        boolean ok,
        long recordsChecked,
        UUID firstBrokenRecordId,
        Long firstBrokenSequence,
        TamperReason reason,
        TamperReason recordReason,
        String detail
) {

    static ChainVerificationResult intact(String partitionId, long recordsChecked) {
        return new ChainVerificationResult(partitionId, true, recordsChecked, null, null, null, null, null);
    }

    static ChainVerificationResult broken(String partitionId, long recordsChecked, UUID recordId,
                                          Long sequence, TamperReason recordReason, String detail) {
        return new ChainVerificationResult(partitionId, false, recordsChecked, recordId, sequence,
                TamperReason.CHAIN_BREAK, recordReason, detail);
    }
}
