package com.bit.bchpool.block;

import com.bit.bchpool.util.ByteUtils;
import com.bit.bchpool.util.Sha;

import java.util.ArrayList;
import java.util.List;

/**
 * Merkle 树计算
 * 入参与返回值均为显示顺序（大端）哈希，内部计算使用小端
 */
public final class MerkleEngine {

    public static final int HASH_LENGTH = 32;

    private MerkleEngine() {
    }

    /**
     * 计算 Merkle 根：空列表返回全零，单个元素返回自身，奇数层复制最后一个
     */
    public static byte[] computeRoot(List<byte[]> hashes) {
        if (hashes == null || hashes.isEmpty()) {
            return new byte[HASH_LENGTH];
        }
        if (hashes.size() == 1) {
            return hashes.get(0).clone();
        }
        List<byte[]> level = toInternal(hashes);
        while (level.size() > 1) {
            level = nextLevel(level);
        }
        return ByteUtils.reverse(level.get(0));
    }

    public static String computeRootHex(List<String> hashes) {
        List<byte[]> bytes = new ArrayList<>(hashes.size());
        for (String hash : hashes) {
            bytes.add(ByteUtils.hexToBytes(hash));
        }
        return ByteUtils.bytesToHex(computeRoot(bytes));
    }

    /**
     * 计算 targetIndex 位置叶子的 Merkle 分支（逐层兄弟节点，显示顺序）
     */
    public static List<byte[]> computeBranch(List<byte[]> hashes, int targetIndex) {
        if (hashes == null || targetIndex < 0 || targetIndex >= hashes.size()) {
            throw new IllegalArgumentException("叶子下标越界: " + targetIndex);
        }
        List<byte[]> branch = new ArrayList<>();
        List<byte[]> level = toInternal(hashes);
        int index = targetIndex;
        while (level.size() > 1) {
            if (level.size() % 2 != 0) {
                level.add(level.get(level.size() - 1));
            }
            branch.add(ByteUtils.reverse(level.get(index ^ 1)));
            level = nextLevel(level);
            index >>= 1;
        }
        return branch;
    }

    /**
     * 用叶子哈希与分支折叠出根（叶子在最左侧，即coinbase位置）
     * 入参、返回值均为内部字节序，与矿工侧计算方式一致
     */
    public static byte[] foldBranch(byte[] leafInternal, List<byte[]> branchInternal) {
        byte[] root = leafInternal;
        for (byte[] sibling : branchInternal) {
            root = Sha.applyDoubleSHA256(root, sibling);
        }
        return root;
    }

    private static List<byte[]> toInternal(List<byte[]> hashes) {
        List<byte[]> level = new ArrayList<>(hashes.size() + 1);
        for (byte[] hash : hashes) {
            if (hash == null || hash.length != HASH_LENGTH) {
                throw new IllegalArgumentException("哈希长度必须为32字节");
            }
            level.add(ByteUtils.reverse(hash));
        }
        return level;
    }

    private static List<byte[]> nextLevel(List<byte[]> level) {
        if (level.size() % 2 != 0) {
            level.add(level.get(level.size() - 1));
        }
        List<byte[]> next = new ArrayList<>(level.size() / 2 + 1);
        for (int i = 0; i < level.size(); i += 2) {
            next.add(Sha.applyDoubleSHA256(level.get(i), level.get(i + 1)));
        }
        return next;
    }
}
