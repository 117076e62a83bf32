package com.carbondna.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class MerkleAnchorPropertyTest {

    @Property(tries = 50)
    void anchor_matchesOnlySameRootAndCount(
            @ForAll @IntRange(min = 1, max = 10_000) int count,
            @ForAll("hashes") String root,
            @ForAll("hashes") String otherRoot) {

        Assume.that(!root.equals(otherRoot));
        MerkleAnchor anchor = MerkleAnchor.create("org-1", LocalDate.of(2024, 5, 1), root,
                count, 1, count, null);

        assertThat(anchor.matches(root, count)).isTrue();
        assertThat(anchor.matches(otherRoot, count)).isFalse();
        assertThat(anchor.matches(root, count + 1)).isFalse();
        assertThat(anchor.getCreatedAt()).isNotNull();
    }

    @Example
    void emptyAnchor_isRejected() {
        assertThatThrownBy(() -> MerkleAnchor.create("org-1", LocalDate.of(2024, 5, 1),
                "a".repeat(64), 0, 1, 1, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one record");
    }

    @Provide
    Arbitrary<String> hashes() {
        return Arbitraries.strings().withChars("0123456789abcdef").ofLength(64);
    }
}
