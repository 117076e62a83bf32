package com.carbondna.api.verification;

import java.time.LocalDate;

public record AnchorVerificationResult(
        String partitionId,
        LocalDate periodDate,
        boolean ok,
        TamperReason reason,
        String anchoredRoot,
        String computedRoot,
        int anchoredCount,
        int computedCount
) {}
