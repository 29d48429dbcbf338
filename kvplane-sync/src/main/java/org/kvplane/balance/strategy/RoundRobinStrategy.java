package org.kvplane.balance.strategy;

import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.enums.RouterMode;
import org.kvplane.enums.StatusEnum;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Cycles through the workers in worker order
 */
@Component("roundRobinStrategy")
public class RoundRobinStrategy implements LoadBalancer {

    private final AtomicLong counter = new AtomicLong();

    public RoundRobinStrategy() {
        LoadBalanceStrategyFactory.register(RouterMode.ROUND_ROBIN, this);
    }

    @Override
    public WorkerRef select(Collection<WorkerRef> workers) {
        if (workers == null || workers.isEmpty()) {
            throw StatusEnum.NO_ELIGIBLE_WORKER.toException("no live worker for round robin");
        }
        List<WorkerRef> ordered = workers.stream().sorted().collect(Collectors.toList());
        int idx = (int) Math.floorMod(counter.getAndIncrement(), (long) ordered.size());
        return ordered.get(idx);
    }
}
