package org.kvplane.exception;

import org.kvplane.enums.StatusEnum;

public class JsonMapperException extends KvPlaneException {

    public JsonMapperException(int code, String name, String message, Throwable cause) {
        super(code, name, message, cause);
    }

    public JsonMapperException(int code, String name, String message) {
        super(code, name, message);
    }

    public JsonMapperException(StatusEnum statusEnum) {
        super(statusEnum);
    }
}
