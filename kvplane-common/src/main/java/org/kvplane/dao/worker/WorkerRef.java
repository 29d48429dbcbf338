package org.kvplane.dao.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Comparator;

/**
 * Identity of a schedulable worker: the worker process id plus its data-parallel rank.
 * <p>
 * Ordered by worker id, then by rank. This order is the deterministic tie-break order used by the scheduler.
 */
@Getter
@EqualsAndHashCode
public final class WorkerRef implements Comparable<WorkerRef> {

    private static final Comparator<WorkerRef> ORDER = Comparator
            .comparingLong(WorkerRef::getWorkerId)
            .thenComparingInt(WorkerRef::getDpRank);

    private final long workerId;

    private final int dpRank;

    @JsonCreator
    public WorkerRef(@JsonProperty("workerId") long workerId, @JsonProperty("dpRank") int dpRank) {
        if (dpRank < 0) {
            throw new IllegalArgumentException("dpRank must not be negative: " + dpRank);
        }
        this.workerId = workerId;
        this.dpRank = dpRank;
    }

    public static WorkerRef of(long workerId) {
        return new WorkerRef(workerId, 0);
    }

    public static WorkerRef of(long workerId, int dpRank) {
        return new WorkerRef(workerId, dpRank);
    }

    @Override
    public int compareTo(WorkerRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return workerId + "/" + dpRank;
    }
}
