package org.kvplane.planner.connector;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.dao.route.RoleType;
import org.kvplane.planner.domain.ReplicaTarget;
import org.kvplane.planner.domain.ReplicaTargetEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes targets as {@link ReplicaTargetEvent}s for an operator or another component to act on
 */
@Slf4j
public class NotificationScalingConnector implements ScalingConnector {

    private final ApplicationEventPublisher publisher;

    private final Map<RoleType, Integer> published = new ConcurrentHashMap<>();

    public NotificationScalingConnector(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void setReplicas(ReplicaTarget target) {
        Integer previous = published.put(target.getRole(), target.getCount());
        if (Objects.equals(previous, target.getCount())) {
            return;
        }
        log.info("replica target {}: {} -> {}", target.getRole(), previous, target.getCount());
        publisher.publishEvent(new ReplicaTargetEvent(this, target));
    }

    @Override
    public boolean isConverged() {
        return true;
    }
}
