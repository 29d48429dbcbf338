package org.kvplane.cache.hash;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BlockHasherTest {

    private static List<Integer> tokens(int from, int count) {
        return IntStream.range(from, from + count).boxed().collect(Collectors.toList());
    }

    @Test
    void should_reject_non_positive_block_size() {
        assertThrows(IllegalArgumentException.class, () -> new BlockHasher(0));
        assertThrows(IllegalArgumentException.class, () -> new BlockHasher(-4));
    }

    @Test
    void should_hash_full_blocks_only() {
        BlockHasher hasher = new BlockHasher(4);

        assertEquals(2, hasher.computeBlockHashes(tokens(0, 11)).size());
        assertEquals(3, hasher.computeBlockHashes(tokens(0, 12)).size());
        assertTrue(hasher.computeBlockHashes(tokens(0, 3)).isEmpty());
        assertTrue(hasher.computeBlockHashes(null).isEmpty());
    }

    @Test
    void should_share_hashes_for_shared_prefix() {
        BlockHasher hasher = new BlockHasher(4);
        List<Integer> a = tokens(0, 12);
        List<Integer> b = new ArrayList<>(tokens(0, 8));
        b.addAll(tokens(100, 4));

        List<Long> ha = hasher.computeBlockHashes(a);
        List<Long> hb = hasher.computeBlockHashes(b);

        assertEquals(ha.subList(0, 2), hb.subList(0, 2));
        assertNotEquals(ha.get(2), hb.get(2));
    }

    @Test
    void should_chain_parent_hash_into_each_block() {
        BlockHasher hasher = new BlockHasher(2);
        // same second block tokens behind different first blocks
        List<Long> ha = hasher.computeBlockHashes(List.of(1, 2, 5, 6));
        List<Long> hb = hasher.computeBlockHashes(List.of(3, 4, 5, 6));

        assertNotEquals(ha.get(1), hb.get(1));
    }
}
