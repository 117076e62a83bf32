package com.carbondna.api.anchor;

import java.time.LocalDate;

public record InclusionVerification(
        boolean ok,
        String partitionId,
        LocalDate periodDate,
        String leafHash,
        String anchorRoot
) {}
