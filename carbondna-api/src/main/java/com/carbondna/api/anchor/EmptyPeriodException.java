package com.carbondna.api.anchor;

import java.time.LocalDate;

/**
 * A period without records gets no anchor.
 */
public class EmptyPeriodException extends RuntimeException {

    public EmptyPeriodException(String partitionId, LocalDate period) {
        super("Period " + period + " of partition '" + partitionId + "' has no records to anchor");
    }
}
