package org.kvplane.enums;

/**
 * Sequence indexer variant, fixed at construction
 */
public enum IndexerMode {

    /**
     * Fed by explicit stored/removed events from the workers
     */
    EXACT,
    /**
     * Assumes a worker keeps the blocks it was routed for a fixed TTL
     */
    APPROXIMATE,
    /**
     * Overlap is always zero
     */
    NONE
}
