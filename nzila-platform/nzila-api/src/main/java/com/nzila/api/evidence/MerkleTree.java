package com.nzila.api.evidence;

import com.nzila.core.hash.ContentHashing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binary Merkle tree over hex leaf hashes. An odd level duplicates its last node.
 */
public class MerkleTree {

    private final List<String> leaves;
    private final List<List<String>> levels;

    private MerkleTree(List<String> leaves, List<List<String>> levels) {
        this.leaves = Collections.unmodifiableList(leaves);
        this.levels = levels;
    }

    public static MerkleTree build(List<String> leafHashes) {
        if (leafHashes == null || leafHashes.isEmpty()) {
            throw new IllegalArgumentException("Cannot build Merkle tree from empty list");
        }

        List<List<String>> levels = new ArrayList<>();
        List<String> current = new ArrayList<>(leafHashes);
        levels.add(current);

        while (current.size() > 1) {
            if (current.size() % 2 != 0) {
                current.add(current.get(current.size() - 1));
            }
            List<String> next = new ArrayList<>();
            for (int i = 0; i < current.size(); i += 2) {
                next.add(hashPair(current.get(i), current.get(i + 1)));
            }
            levels.add(next);
            current = next;
        }
        return new MerkleTree(List.copyOf(leafHashes), levels);
    }

    public String getRoot() {
        return levels.get(levels.size() - 1).get(0);
    }

    public List<String> getLeaves() {
        return leaves;
    }

    public int size() {
        return leaves.size();
    }

    /**
     * Sibling path from a leaf up to the root.
     */
    public MerkleProof getProof(int leafIndex) {
        if (leafIndex < 0 || leafIndex >= leaves.size()) {
            throw new IndexOutOfBoundsException("Leaf index out of bounds: " + leafIndex);
        }
        List<ProofStep> steps = new ArrayList<>();
        int index = leafIndex;
        for (int level = 0; level < levels.size() - 1; level++) {
            List<String> nodes = levels.get(level);
            boolean isRightChild = index % 2 != 0;
            int sibling = isRightChild ? index - 1 : index + 1;
            steps.add(new ProofStep(nodes.get(sibling), isRightChild));
            index = index / 2;
        }
        return new MerkleProof(leaves.get(leafIndex), leafIndex, List.copyOf(steps));
    }

    public static boolean verifyProof(MerkleProof proof, String expectedRoot) {
        String hash = proof.leafHash();
        for (ProofStep step : proof.steps()) {
            hash = step.siblingOnLeft() ? hashPair(step.siblingHash(), hash) : hashPair(hash, step.siblingHash());
        }
        return hash.equals(expectedRoot);
    }

    private static String hashPair(String left, String right) {
        return ContentHashing.sha256(left + right);
    }

    public record ProofStep(String siblingHash, boolean siblingOnLeft) {}

    public record MerkleProof(String leafHash, int leafIndex, List<ProofStep> steps) {}
}
