package com.carbondna.api.verification;

import java.time.Instant;
import java.util.List;

/**
 * Full check of one partition: the whole chain plus every stored anchor.
 */
public record LedgerIntegrityReport(
        String partitionId,
        boolean ok,
        ChainVerificationResult chain,
        List<AnchorVerificationResult> anchors,
        Instant checkedAt
) {

    public long failedAnchors() {
        return anchors.stream().filter(a -> !a.ok()).count();
    }
}
