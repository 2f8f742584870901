package com.accessibility.checker.exception;

import com.accessibility.checker.model.FailureKind;
import lombok.Getter;

/**
 * Raised by an image label detector when a single image cannot be analyzed.
 * Never escapes the orchestrator; it is turned into a failed analysis result.
 */
@Getter
public class ImageAnalysisException extends AccessibilityCheckerException {

    private final FailureKind kind;

    public ImageAnalysisException(String message, FailureKind kind) {
        super(message, "IMAGE_ANALYSIS_ERROR");
        this.kind = kind;
    }

    public ImageAnalysisException(String message, FailureKind kind, Throwable cause) {
        super(message, "IMAGE_ANALYSIS_ERROR", cause);
        this.kind = kind;
    }

    public static ImageAnalysisException transientFailure(String message, Throwable cause) {
        return new ImageAnalysisException(message, FailureKind.TRANSIENT, cause);
    }

    public static ImageAnalysisException permanentFailure(String message) {
        return new ImageAnalysisException(message, FailureKind.PERMANENT);
    }

    public boolean isRetryable() {
        return kind == FailureKind.TRANSIENT;
    }
}
