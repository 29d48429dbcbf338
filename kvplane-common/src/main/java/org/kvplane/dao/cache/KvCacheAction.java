package org.kvplane.dao.cache;

public enum KvCacheAction {
    STORED,
    REMOVED
}
