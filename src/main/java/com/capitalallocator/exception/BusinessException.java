package com.capitalallocator.exception;

import java.util.Map;

/** Caller input that breaks an account or position rule. Nothing is changed when it is thrown. */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public BusinessException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
