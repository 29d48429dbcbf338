package org.kvplane.planner.domain;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the planner asks for a new replica count and no orchestration API is configured
 */
@Getter
public class ReplicaTargetEvent extends ApplicationEvent {

    private final ReplicaTarget target;

    public ReplicaTargetEvent(Object source, ReplicaTarget target) {
        super(source);
        this.target = target;
    }
}
