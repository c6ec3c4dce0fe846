package com.bit.vault.keeper;

import com.bit.vault.util.Keccak;
import com.google.common.primitives.UnsignedBytes;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 有序对默克尔证明：父节点 = keccak256(min(a,b) ‖ max(a,b))
 */
public final class MerkleProofs {

    private static final Comparator<byte[]> ORDER = UnsignedBytes.lexicographicalComparator();

    private MerkleProofs() {
    }

    public static boolean verify(List<byte[]> proof, byte[] root, byte[] leaf) {
        if (proof == null || root == null || leaf == null) {
            return false;
        }
        byte[] computed = leaf;
        for (byte[] sibling : proof) {
            if (sibling == null || sibling.length != 32) {
                return false;
            }
            computed = hashPair(computed, sibling);
        }
        return Arrays.equals(computed, root);
    }

    static byte[] hashPair(byte[] a, byte[] b) {
        return ORDER.compare(a, b) <= 0 ? Keccak.keccak256(a, b) : Keccak.keccak256(b, a);
    }
}
