package org.kvplane.balance.scheduler;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.kvplane.dao.worker.WorkerRef;

import java.util.Comparator;

@Getter
@ToString
@AllArgsConstructor
class ScoredWorker {

    /**
     * Tie-break order: lowest KV utilization, then worker order
     */
    static final Comparator<ScoredWorker> TIE_BREAK = Comparator
            .comparingDouble(ScoredWorker::getUtilization)
            .thenComparing(ScoredWorker::getWorker);

    private final WorkerRef worker;

    private final int overlapBlocks;

    private final double utilization;

    private final double score;
}
