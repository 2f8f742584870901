package com.accessibility.checker.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Identifies one image in external storage (bucket/container + object key).
 */
@Value
@Builder
@Jacksonized
public class ImageRef {
    String container;
    String key;

    public static ImageRef of(String container, String key) {
        return new ImageRef(container, key);
    }

    @Override
    public String toString() {
        return container + "/" + key;
    }
}
