package com.carbondna.api.anchor;

import com.carbondna.api.hashing.RecordHasher;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the anchoring Merkle tree.
 */
class MerkleTreePropertyTest {

    @Property(tries = 100)
    void everyLeaf_hasAProofThatReachesTheRoot(
            @ForAll @Size(min = 1, max = 40) List<@From("hashes") String> leaves) {

        MerkleTree tree = MerkleTree.build(leaves);

        assertThat(tree.getRoot()).matches("[0-9a-f]{64}");
        assertThat(tree.size()).isEqualTo(leaves.size());
        for (int i = 0; i < leaves.size(); i++) {
            MerkleTree.MerkleProof proof = tree.getProof(i);
            assertThat(proof.leafHash()).isEqualTo(leaves.get(i));
            assertThat(proof.leafIndex()).isEqualTo(i);
            assertThat(MerkleTree.verifyProof(proof, tree.getRoot()))
                    .as("proof of leaf %d", i)
                    .isTrue();
        }
    }

    @Property(tries = 100)
    void serializedProof_stillVerifies(
            @ForAll @Size(min = 2, max = 25) List<@From("hashes") String> leaves,
            @ForAll @IntRange(min = 0, max = 24) int index) {

        Assume.that(index < leaves.size());
        MerkleTree tree = MerkleTree.build(leaves);
        MerkleTree.MerkleProof proof = tree.getProof(index);

        MerkleTree.MerkleProof restored = MerkleTree.MerkleProof.deserialize(proof.serialize());

        assertThat(restored).isEqualTo(proof);
        assertThat(MerkleTree.verifyProof(restored, tree.getRoot())).isTrue();
    }

    @Property(tries = 100)
    void alteringOneLeaf_changesTheRoot(
            @ForAll @Size(min = 1, max = 30) List<@From("hashes") String> leaves,
            @ForAll @IntRange(min = 0, max = 29) int index,
            @ForAll("hashes") String replacement) {

        Assume.that(index < leaves.size());
        Assume.that(!leaves.get(index).equals(replacement));
        List<String> altered = new ArrayList<>(leaves);
        altered.set(index, replacement);

        assertThat(MerkleTree.build(altered).getRoot()).isNotEqualTo(MerkleTree.build(leaves).getRoot());
    }

    @Property(tries = 50)
    void proof_failsAgainstAnotherRoot(
            @ForAll @Size(min = 1, max = 20) List<@From("hashes") String> leaves,
            @ForAll("hashes") String otherRoot) {

        MerkleTree tree = MerkleTree.build(leaves);
        Assume.that(!tree.getRoot().equals(otherRoot));

        assertThat(MerkleTree.verifyProof(tree.getProof(0), otherRoot)).isFalse();
    }

    @Test
    void singleLeaf_isPairedWithItself() {
        String leaf = "a".repeat(64);

        MerkleTree tree = MerkleTree.build(List.of(leaf));

        assertThat(tree.getRoot()).isEqualTo(sha256(leaf + leaf));
    }

    @Test
    void oddLevel_duplicatesItsLastNode() {
        String a = "a".repeat(64);
        String b = "b".repeat(64);
        String c = "c".repeat(64);

        String expected = sha256(sha256(a + b) + sha256(c + c));

        assertThat(MerkleTree.build(List.of(a, b, c)).getRoot()).isEqualTo(expected);
    }

    @Test
    void leafOrder_matters() {
        String a = "a".repeat(64);
        String b = "b".repeat(64);

        assertThat(MerkleTree.build(List.of(a, b)).getRoot())
                .isNotEqualTo(MerkleTree.build(List.of(b, a)).getRoot());
    }

    @Test
    void invalidInput_isRejected() {
        assertThatThrownBy(() -> MerkleTree.build(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MerkleTree.build(List.of("not-a-hash")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MerkleTree.MerkleProof.deserialize("abc:1:2"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MerkleTree.MerkleProof.deserialize("abc:x::def"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MerkleTree.build(List.of("a".repeat(64))).getProof(1))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    private static String sha256(String input) {
        return RecordHasher.sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    @Provide
    Arbitrary<String> hashes() {
        return Arbitraries.strings().withChars("0123456789abcdef").ofLength(64);
    }
}
