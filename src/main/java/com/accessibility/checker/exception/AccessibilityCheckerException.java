package com.accessibility.checker.exception;

import lombok.Getter;

/**
 * Base type for request-level errors. Carries a stable error code for API responses.
 */
@Getter
public class AccessibilityCheckerException extends RuntimeException {

    private final String errorCode;

    public AccessibilityCheckerException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public AccessibilityCheckerException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
