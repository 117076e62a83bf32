package com.carbondna.api.anchor;

import java.time.LocalDate;

public class PeriodNotClosedException extends RuntimeException {

    public PeriodNotClosedException(String partitionId, LocalDate period) {
        super("Period " + period + " of partition '" + partitionId + "' has not closed yet");
    }
}
