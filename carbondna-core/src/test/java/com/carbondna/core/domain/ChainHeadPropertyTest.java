package com.carbondna.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for chain head advancement.
 */
class ChainHeadPropertyTest {

    @Property(tries = 100)
    void advancingThroughLinkedRecords_tracksLastRecord(
            @ForAll @Size(min = 1, max = 30) List<@From("hashes") String> recordHashes) {

        Assume.that(recordHashes.stream().distinct().count() == recordHashes.size());
        Assume.that(!recordHashes.contains(LedgerRecord.GENESIS_HASH));

        ChainHead head = ChainHead.genesis("org-1", Instant.now());
        assertThat(head.isEmpty()).isTrue();
        assertThat(head.getHeadHash()).isEqualTo(LedgerRecord.GENESIS_HASH);

        List<LedgerRecord> records = new ArrayList<>();
        for (String hash : recordHashes) {
            LedgerRecord record = LedgerRecord.create("org-1", head.nextSequence(), "{}",
                    "0".repeat(32), head.getHeadHash(), hash, Instant.now(), null);
            head.advance(record);
            records.add(record);
        }

        assertThat(head.getSequence()).isEqualTo(recordHashes.size());
        assertThat(head.getHeadHash()).isEqualTo(recordHashes.get(recordHashes.size() - 1));
        for (int i = 1; i < records.size(); i++) {
            assertThat(records.get(i).getPreviousHash()).isEqualTo(records.get(i - 1).getRecordHash());
        }
    }

    @Property(tries = 50)
    void advance_rejectsRecordNotLinkedToHead(@ForAll("hashes") String stalePrevious) {
        Assume.that(!stalePrevious.equals(LedgerRecord.GENESIS_HASH));

        ChainHead head = ChainHead.genesis("org-1", Instant.now());
        LedgerRecord first = LedgerRecord.create("org-1", 1, "{}", "0".repeat(32),
                LedgerRecord.GENESIS_HASH, "1".repeat(64), Instant.now(), null);
        head.advance(first);

        Assume.that(!stalePrevious.equals(head.getHeadHash()));
        LedgerRecord forked = LedgerRecord.create("org-1", 2, "{}", "0".repeat(32),
                stalePrevious, "2".repeat(64), Instant.now(), null);

        assertThatThrownBy(() -> head.advance(forked))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("current head");
    }

    @Example
    void advance_rejectsRecordFromOtherPartition() {
        ChainHead head = ChainHead.genesis("org-1", Instant.now());
        LedgerRecord foreign = LedgerRecord.create("org-2", 1, "{}", "0".repeat(32),
                LedgerRecord.GENESIS_HASH, "1".repeat(64), Instant.now(), null);

        assertThatThrownBy(() -> head.advance(foreign))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void advance_rejectsSequenceGap() {
        ChainHead head = ChainHead.genesis("org-1", Instant.now());
        LedgerRecord skipped = LedgerRecord.create("org-1", 3, "{}", "0".repeat(32),
                "9".repeat(64), "1".repeat(64), Instant.now(), null);

        assertThatThrownBy(() -> head.advance(skipped))
                .isInstanceOf(IllegalStateException.class);
    }

    @Provide
    Arbitrary<String> hashes() {
        return Arbitraries.strings().withChars("0123456789abcdef").ofLength(64);
    }
}
