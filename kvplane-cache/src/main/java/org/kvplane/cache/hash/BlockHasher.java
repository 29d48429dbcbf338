package org.kvplane.cache.hash;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a token sequence into fixed-size blocks and chain-hashes them.
 * <p>
 * The hash of block {@code i} covers the hash of block {@code i - 1} and the tokens of block {@code i}, so two
 * sequences share a block hash only if they share the whole prefix up to and including that block.
 * A trailing partial block is not hashed.
 */
public class BlockHasher {

    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128(1337);

    @Getter
    private final int blockSize;

    public BlockHasher(int blockSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize must be > 0, got " + blockSize);
        }
        this.blockSize = blockSize;
    }

    /**
     * @param tokens token ids of the request
     * @return one hash per full block, in sequence order
     */
    public List<Long> computeBlockHashes(List<Integer> tokens) {
        if (tokens == null || tokens.size() < blockSize) {
            return Collections.emptyList();
        }
        int fullBlocks = tokens.size() / blockSize;
        List<Long> hashes = new ArrayList<>(fullBlocks);
        long parent = 0L;
        for (int block = 0; block < fullBlocks; block++) {
            Hasher hasher = HASH_FUNCTION.newHasher();
            if (block > 0) {
                hasher.putLong(parent);
            }
            int start = block * blockSize;
            for (int i = start; i < start + blockSize; i++) {
                hasher.putInt(tokens.get(i));
            }
            parent = hasher.hash().asLong();
            hashes.add(parent);
        }
        return hashes;
    }
}
