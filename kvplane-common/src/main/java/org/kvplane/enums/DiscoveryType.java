package org.kvplane.enums;

public enum DiscoveryType {
    STATIC,
    ZOOKEEPER
}
