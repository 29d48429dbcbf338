package org.kvplane.exception;

import org.kvplane.enums.StatusEnum;

public class ScalingConnectorException extends KvPlaneException {

    public ScalingConnectorException(int code, String name, String message, Throwable cause) {
        super(code, name, message, cause);
    }

    public ScalingConnectorException(int code, String name, String message) {
        super(code, name, message);
    }

    public ScalingConnectorException(StatusEnum statusEnum) {
        super(statusEnum);
    }
}
