package org.kvplane.dao.route;

import lombok.Getter;

@Getter
public enum RoleType {
    PREFILL("prefill"),
    DECODE("decode");

    /**
     * Role name used by the orchestration layer unless configured otherwise
     */
    private final String defaultRoleName;

    RoleType(String defaultRoleName) {
        this.defaultRoleName = defaultRoleName;
    }
}
