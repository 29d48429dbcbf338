package org.kvplane.balance.scheduler;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.kvplane.dao.worker.WorkerRef;

@Data
@AllArgsConstructor
class Reservation {

    private final String requestId;

    private final WorkerRef worker;

    private final long decodeBlocks;

    private final long prefillTokens;

    private boolean prefillDone;
}
