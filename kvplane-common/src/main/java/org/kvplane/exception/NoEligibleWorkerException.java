package org.kvplane.exception;

import org.kvplane.enums.StatusEnum;

public class NoEligibleWorkerException extends KvPlaneException {

    @Override
    public boolean isSimpleException() {
        return true;
    }

    public NoEligibleWorkerException(int code, String name, String message, Throwable cause) {
        super(code, name, message, cause);
    }

    public NoEligibleWorkerException(int code, String name, String message) {
        super(code, name, message);
    }

    public NoEligibleWorkerException(StatusEnum statusEnum) {
        super(statusEnum);
    }
}
