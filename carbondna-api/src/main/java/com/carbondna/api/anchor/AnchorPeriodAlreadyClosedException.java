package com.carbondna.api.anchor;

import java.time.LocalDate;

/**
 * The period already has an anchor and the records now in it produce a
 * different root or count. Either records were altered after anchoring or a
 * late record landed in a closed period; anchors are never overwritten.
 */
public class AnchorPeriodAlreadyClosedException extends RuntimeException {

    private final String storedRoot;
    private final String computedRoot;

    public AnchorPeriodAlreadyClosedException(String partitionId, LocalDate period,
                                              String storedRoot, String computedRoot) {
        super("Period " + period + " of partition '" + partitionId + "' is already anchored with root "
                + storedRoot + "; recomputed root is " + computedRoot);
        this.storedRoot = storedRoot;
        this.computedRoot = computedRoot;
    }

    public String getStoredRoot() {
        return storedRoot;
    }

    public String getComputedRoot() {
        return computedRoot;
    }
}
