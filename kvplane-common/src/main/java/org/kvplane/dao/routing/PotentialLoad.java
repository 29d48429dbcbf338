package org.kvplane.dao.routing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kvplane.dao.worker.WorkerRef;

/**
 * Load a worker would carry if a given sequence were routed to it
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PotentialLoad {

    private WorkerRef worker;

    private long potentialDecodeBlocks;

    private long potentialPrefillTokens;
}
