package com.accessibility.checker.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Recommendation {
    String title;
    String description;
    String priority;   // high, medium, low
    String category;   // safety, improvement, ...
}
