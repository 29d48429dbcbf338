package org.kvplane.exception;

import org.kvplane.enums.StatusEnum;

public class ServiceDiscoveryException extends KvPlaneException {

    public ServiceDiscoveryException(int code, String name, String message, Throwable cause) {
        super(code, name, message, cause);
    }

    public ServiceDiscoveryException(int code, String name, String message) {
        super(code, name, message);
    }

    public ServiceDiscoveryException(StatusEnum statusEnum) {
        super(statusEnum);
    }
}
