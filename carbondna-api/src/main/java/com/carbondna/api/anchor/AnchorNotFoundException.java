package com.carbondna.api.anchor;

import java.time.LocalDate;

public class AnchorNotFoundException extends RuntimeException {

    public AnchorNotFoundException(String partitionId, LocalDate period) {
        super("No anchor for period " + period + " of partition '" + partitionId + "'");
    }
}
