package org.kvplane.enums;

/**
 * Where replica targets are sent
 */
public enum ConnectorType {
    /**
     * Declarative orchestration API over HTTP
     */
    ORCHESTRATION,
    /**
     * Publish an application event and log, nothing is actuated
     */
    NOTIFICATION
}
