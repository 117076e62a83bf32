package com.carbondna.api.verification;

/**
 * Why a verification failed.
 */
public enum TamperReason {
    /** Recomputed record hash differs from the stored one. */
    HASH_MISMATCH,
    /** Record does not link to its predecessor, or the sequence has a gap. */
    CHAIN_BREAK,
    /** Recomputed Merkle root or count differs from the stored anchor. */
    ANCHOR_MISMATCH
}
