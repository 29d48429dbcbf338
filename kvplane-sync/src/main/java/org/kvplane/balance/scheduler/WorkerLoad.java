package org.kvplane.balance.scheduler;

import lombok.Getter;

/**
 * In-flight load of one worker. Written by the scheduler loop only, never below zero.
 */
@Getter
public class WorkerLoad {

    static final WorkerLoad EMPTY = new WorkerLoad();

    private volatile long decodeBlocks;

    private volatile long prefillTokens;

    void add(long decode, long prefill) {
        decodeBlocks += decode;
        prefillTokens += prefill;
    }

    void subtract(long decode, long prefill) {
        decodeBlocks = Math.max(0, decodeBlocks - decode);
        prefillTokens = Math.max(0, prefillTokens - prefill);
    }

    boolean isIdle() {
        return decodeBlocks == 0 && prefillTokens == 0;
    }
}
