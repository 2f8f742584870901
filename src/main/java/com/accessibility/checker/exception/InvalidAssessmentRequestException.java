package com.accessibility.checker.exception;

public class InvalidAssessmentRequestException extends AccessibilityCheckerException {

    public InvalidAssessmentRequestException(String message) {
        super(message, "INVALID_INPUT");
    }
}
