package org.kvplane.enums;

/**
 * How requests are assigned to workers
 */
public enum RouterMode {

    /**
     * KV-cache aware scheduling with round-robin fallback
     */
    KV,
    ROUND_ROBIN,
    RANDOM
}
