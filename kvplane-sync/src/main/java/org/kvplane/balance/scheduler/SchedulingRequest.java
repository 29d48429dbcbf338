package org.kvplane.balance.scheduler;

import lombok.Builder;
import lombok.Data;
import org.kvplane.dao.routing.RouterConfigOverride;
import org.kvplane.dao.worker.WorkerRef;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Builder
public class SchedulingRequest {

    /**
     * Null for query-only requests
     */
    private String requestId;

    @Builder.Default
    private List<Long> blockHashes = Collections.emptyList();

    /**
     * Prompt length in tokens, including a trailing partial block
     */
    private long inputLength;

    /**
     * Matched prefix blocks per worker, missing workers count as zero
     */
    @Builder.Default
    private Map<WorkerRef, Integer> overlaps = Collections.emptyMap();

    @Builder.Default
    private Set<WorkerRef> candidates = Collections.emptySet();

    private RouterConfigOverride override;

    /**
     * Reserve load on the chosen worker
     */
    private boolean updateStates;

    public int overlapOf(WorkerRef worker) {
        Integer overlap = overlaps.get(worker);
        return overlap == null ? 0 : overlap;
    }

    public boolean isMutating() {
        return updateStates && requestId != null;
    }
}
