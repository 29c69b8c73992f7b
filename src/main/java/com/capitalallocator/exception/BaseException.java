package com.capitalallocator.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the allocator's exceptions. {@code details} carries the ids and amounts involved so
 * they can be logged and attached to risk events without parsing the message.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean isRecoverable() {
        return errorCode.isRecoverable();
    }
}
