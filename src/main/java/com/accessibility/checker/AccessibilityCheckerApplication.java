package com.accessibility.checker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AccessibilityCheckerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessibilityCheckerApplication.class, args);
    }
}
