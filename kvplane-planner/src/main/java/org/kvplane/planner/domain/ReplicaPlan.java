package org.kvplane.planner.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kvplane.dao.route.RoleType;

import java.util.Arrays;
import java.util.List;

/**
 * Replica counts for both roles, after budget scaling and clamping
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplicaPlan {

    private int prefillReplicas;

    private int decodeReplicas;

    /**
     * Counts before any budget scaling or clamping
     */
    private int unclampedPrefillReplicas;

    private int unclampedDecodeReplicas;

    /**
     * The minimum replica counts alone exceed the GPU budget
     */
    private boolean capacityInfeasible;

    public List<ReplicaTarget> targets() {
        return Arrays.asList(new ReplicaTarget(RoleType.PREFILL, prefillReplicas),
                new ReplicaTarget(RoleType.DECODE, decodeReplicas));
    }
}
