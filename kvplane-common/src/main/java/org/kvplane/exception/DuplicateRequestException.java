package org.kvplane.exception;

import org.kvplane.enums.StatusEnum;

public class DuplicateRequestException extends KvPlaneException {

    @Override
    public boolean isSimpleException() {
        return true;
    }

    public DuplicateRequestException(int code, String name, String message, Throwable cause) {
        super(code, name, message, cause);
    }

    public DuplicateRequestException(int code, String name, String message) {
        super(code, name, message);
    }

    public DuplicateRequestException(StatusEnum statusEnum) {
        super(statusEnum);
    }
}
