package org.kvplane.balance.strategy;

import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.enums.RouterMode;
import org.kvplane.enums.StatusEnum;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

@Component("randomStrategy")
public class RandomStrategy implements LoadBalancer {

    public RandomStrategy() {
        LoadBalanceStrategyFactory.register(RouterMode.RANDOM, this);
    }

    @Override
    public WorkerRef select(Collection<WorkerRef> workers) {
        if (workers == null || workers.isEmpty()) {
            throw StatusEnum.NO_ELIGIBLE_WORKER.toException("no live worker for random selection");
        }
        List<WorkerRef> candidates = new ArrayList<>(workers);
        int idx = ThreadLocalRandom.current().nextInt(candidates.size());
        return candidates.get(idx);
    }
}
