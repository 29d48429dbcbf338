package org.kvplane.exception;

import org.kvplane.enums.StatusEnum;

public class SchedulerUnavailableException extends KvPlaneException {

    @Override
    public boolean isSimpleException() {
        return true;
    }

    public SchedulerUnavailableException(int code, String name, String message, Throwable cause) {
        super(code, name, message, cause);
    }

    public SchedulerUnavailableException(int code, String name, String message) {
        super(code, name, message);
    }

    public SchedulerUnavailableException(StatusEnum statusEnum) {
        super(statusEnum);
    }
}
