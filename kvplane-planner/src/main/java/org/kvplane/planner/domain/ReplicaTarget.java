package org.kvplane.planner.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kvplane.dao.route.RoleType;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReplicaTarget {

    private RoleType role;

    private int count;
}
