package com.accessibility.checker.model;

public enum KeywordCategory {
    POSITIVE,
    BARRIER
}
