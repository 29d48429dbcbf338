package org.kvplane.exception;

import org.kvplane.enums.StatusEnum;

public class MetricsSourceException extends KvPlaneException {

    public MetricsSourceException(int code, String name, String message, Throwable cause) {
        super(code, name, message, cause);
    }

    public MetricsSourceException(int code, String name, String message) {
        super(code, name, message);
    }

    public MetricsSourceException(StatusEnum statusEnum) {
        super(statusEnum);
    }
}
