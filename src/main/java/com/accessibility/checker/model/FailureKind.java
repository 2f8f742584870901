package com.accessibility.checker.model;

/**
 * Why an image analysis did not succeed. Only TRANSIENT failures are retried.
 */
public enum FailureKind {
    TRANSIENT,
    PERMANENT,
    TIMEOUT
}
