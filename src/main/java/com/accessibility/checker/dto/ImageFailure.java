package com.accessibility.checker.dto;

import com.accessibility.checker.model.FailureKind;
import com.accessibility.checker.model.ImageRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageFailure {
    private ImageRef imageRef;
    private String reason;
    private FailureKind kind;
}
