package com.carbondna.api.anchor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Merkle audit path of one record against its period's anchor.
 *
 * @param proof             serialized {@link MerkleTree.MerkleProof}
 * @param rootMatchesAnchor false when the records now in the period no longer
 *                          reproduce the anchored root
 */
public record InclusionProof(
        UUID recordId,
        String partitionId,
        LocalDate periodDate,
        int leafIndex,
        int leafCount,
        String recordHash,
        String anchorRoot,
        String proof,
        boolean rootMatchesAnchor
) {}
