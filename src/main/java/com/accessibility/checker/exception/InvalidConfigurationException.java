package com.accessibility.checker.exception;

import lombok.Getter;

@Getter
public class InvalidConfigurationException extends AccessibilityCheckerException {

    private final String configKey;

    public InvalidConfigurationException(String message, String configKey) {
        super(message, "CONFIGURATION_ERROR");
        this.configKey = configKey;
    }
}
