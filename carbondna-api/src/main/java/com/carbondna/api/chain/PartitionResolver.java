package com.carbondna.api.chain;

import com.carbondna.api.canonical.FieldMap;
import com.carbondna.api.config.LedgerProperties;
import com.carbondna.core.domain.LedgerRecord;
import org.springframework.stereotype.Component;

/**
 * Picks the ledger partition for a payload that arrives without one: the
 * first non-blank configured key (organization unit, then supplier by
 * default), otherwise the default partition.
 */
@Component
public class PartitionResolver {

    private final LedgerProperties properties;

    public PartitionResolver(LedgerProperties properties) {
        this.properties = properties;
    }

    public String resolve(FieldMap payload) {
        for (String key : properties.getPartitionKeys()) {
            var value = payload.text(key);
            if (value.isPresent()) {
                return normalize(value.get());
            }
        }
        return normalize(properties.getDefaultPartition());
    }

    /**
     * Trims and validates an explicit partition id.
     */
    public String normalize(String partitionId) {
        if (partitionId == null || partitionId.isBlank()) {
            throw new IllegalArgumentException("Partition id must not be blank");
        }
        String trimmed = partitionId.strip();
        if (trimmed.length() > LedgerRecord.MAX_PARTITION_LENGTH) {
            throw new IllegalArgumentException("Partition id must be at most "
                    + LedgerRecord.MAX_PARTITION_LENGTH + " characters");
        }
        return trimmed;
    }
}
