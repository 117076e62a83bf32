package com.carbondna.api.anchor;

import com.carbondna.api.hashing.RecordHasher;
import com.carbondna.core.domain.LedgerRecord;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Merkle tree over record hashes of one anchoring period.
 *
 * <p>Adjacent nodes are paired and the parent is the SHA-256 of the UTF-8
 * concatenation of the two lowercase hex children. A level with an odd number
 * of nodes duplicates its last node, so a single leaf is paired with itself.
 */
public final class MerkleTree {

    private final List<String> leaves;
    private final List<List<String>> levels;
    private final String root;

    private MerkleTree(List<String> leaves, List<List<String>> levels, String root) {
        this.leaves = Collections.unmodifiableList(leaves);
        this.levels = levels;
        this.root = root;
    }

    /**
     * Builds the tree from leaf hashes in the order given.
     */
    public static MerkleTree build(List<String> leafHashes) {
        if (leafHashes == null || leafHashes.isEmpty()) {
            throw new IllegalArgumentException("Cannot build Merkle tree from empty list");
        }
        for (String leaf : leafHashes) {
            if (!LedgerRecord.isHash(leaf)) {
                throw new IllegalArgumentException("Leaf is not a SHA-256 hex digest: " + leaf);
            }
        }

        List<List<String>> levels = new ArrayList<>();
        List<String> current = padded(new ArrayList<>(leafHashes));
        levels.add(current);

        while (current.size() > 1) {
            List<String> next = new ArrayList<>(current.size() / 2 + 1);
            for (int i = 0; i < current.size(); i += 2) {
                next.add(hashPair(current.get(i), current.get(i + 1)));
            }
            current = next.size() > 1 ? padded(next) : next;
            levels.add(current);
        }

        return new MerkleTree(new ArrayList<>(leafHashes), levels, current.get(0));
    }

    private static List<String> padded(List<String> level) {
        if (level.size() % 2 != 0) {
            level.add(level.get(level.size() - 1));
        }
        return level;
    }

    public String getRoot() {
        return root;
    }

    public List<String> getLeaves() {
        return leaves;
    }

    public int size() {
        return leaves.size();
    }

    /**
     * Audit path from the leaf at {@code leafIndex} up to the root.
     */
    public MerkleProof getProof(int leafIndex) {
        if (leafIndex < 0 || leafIndex >= leaves.size()) {
            throw new IndexOutOfBoundsException("Leaf index out of bounds: " + leafIndex);
        }

        List<ProofStep> steps = new ArrayList<>();
        int index = leafIndex;
        for (int level = 0; level < levels.size() - 1; level++) {
            List<String> nodes = levels.get(level);
            boolean rightChild = index % 2 != 0;
            int sibling = rightChild ? index - 1 : index + 1;
            steps.add(new ProofStep(nodes.get(sibling), rightChild));
            index /= 2;
        }
        return new MerkleProof(leaves.get(leafIndex), leafIndex, steps, root);
    }

    /**
     * Recomputes the root from a proof and compares it with {@code expectedRoot}.
     */
    public static boolean verifyProof(MerkleProof proof, String expectedRoot) {
        if (proof == null || expectedRoot == null) {
            return false;
        }
        String current = proof.leafHash();
        for (ProofStep step : proof.steps()) {
            current = step.siblingOnLeft()
                    ? hashPair(step.hash(), current)
                    : hashPair(current, step.hash());
        }
        return current.equals(expectedRoot);
    }

    static String hashPair(String left, String right) {
        return RecordHasher.sha256Hex((left + right).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Sibling hash at one level of an audit path.
     */
    public record ProofStep(String hash, boolean siblingOnLeft) {}

    public record MerkleProof(String leafHash, int leafIndex, List<ProofStep> steps, String root) {

        public MerkleProof {
            steps = List.copyOf(steps);
        }

        /**
         * Compact form {@code leaf:index:Lsibling,Rsibling,...:root}.
         */
        public String serialize() {
            StringBuilder sb = new StringBuilder();
            sb.append(leafHash).append(':').append(leafIndex).append(':');
            for (int i = 0; i < steps.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                ProofStep step = steps.get(i);
                sb.append(step.siblingOnLeft() ? 'L' : 'R').append(step.hash());
            }
            sb.append(':').append(root);
            return sb.toString();
        }

        public static MerkleProof deserialize(String serialized) {
            if (serialized == null) {
                throw new IllegalArgumentException("Proof is required");
            }
            String[] parts = serialized.split(":", -1);
            if (parts.length != 4) {
                throw new IllegalArgumentException("Invalid proof format");
            }
            int leafIndex;
            try {
                leafIndex = Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid leaf index in proof: " + parts[1], e);
            }

            List<ProofStep> steps = new ArrayList<>();
            if (!parts[2].isEmpty()) {
                for (String element : parts[2].split(",")) {
                    if (element.length() != 65 || (element.charAt(0) != 'L' && element.charAt(0) != 'R')) {
                        throw new IllegalArgumentException("Invalid proof step: " + element);
                    }
                    steps.add(new ProofStep(element.substring(1), element.charAt(0) == 'L'));
                }
            }
            return new MerkleProof(parts[0], leafIndex, steps, parts[3]);
        }
    }
}
