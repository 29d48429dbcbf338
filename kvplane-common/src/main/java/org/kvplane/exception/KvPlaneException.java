package org.kvplane.exception;

import lombok.Getter;
import org.kvplane.enums.StatusEnum;

/**
 * Base of every domain exception. Carries the numeric code and name of a {@link StatusEnum}.
 */
@Getter
public class KvPlaneException extends RuntimeException {

    private final int code;

    private final String name;

    /**
     * Simple exceptions are logged with their message only, without the stack trace.
     */
    public boolean isSimpleException() {
        return false;
    }

    public KvPlaneException(int code, String name, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.name = name;
    }

    public KvPlaneException(int code, String name, String message) {
        super(message);
        this.code = code;
        this.name = name;
    }

    public KvPlaneException(StatusEnum statusEnum) {
        super(statusEnum.getMessage());
        this.code = statusEnum.getCode();
        this.name = statusEnum.getName();
    }
}
