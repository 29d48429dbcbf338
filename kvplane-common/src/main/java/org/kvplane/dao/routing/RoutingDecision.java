package org.kvplane.dao.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kvplane.dao.worker.WorkerRef;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingDecision {

    private WorkerRef worker;

    /**
     * Matched prefix length on the chosen worker, in blocks
     */
    private int overlapBlocks;

    /**
     * Null for query-only decisions
     */
    private String requestId;

    /**
     * Whether load was reserved on the worker, to be released with free
     */
    private boolean reserved;

    /**
     * Chosen by a naive policy after the KV router failed
     */
    private boolean fallback;
}
