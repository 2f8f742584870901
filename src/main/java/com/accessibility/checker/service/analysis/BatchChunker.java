package com.accessibility.checker.service.analysis;

import com.accessibility.checker.exception.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits an image list into consecutive batches of at most {@code size} elements.
 * Order is kept and every element lands in exactly one batch.
 */
@Component
@Slf4j
public class BatchChunker {

    public <T> List<List<T>> chunk(List<T> images, int size) {
        if (size < 1) {
            throw new InvalidConfigurationException(
                    "Batch size must be at least 1, got " + size, "accessibility.analysis.chunk-size");
        }

        List<List<T>> batches = new ArrayList<>();
        int start = 0;
        while (start < images.size()) {
            // end never exceeds images.size()
            int end = start + Math.min(size, images.size() - start);
            batches.add(Collections.unmodifiableList(new ArrayList<>(images.subList(start, end))));
            start = end;
        }

        log.info("Created {} batches from {} images", batches.size(), images.size());
        return batches;
    }
}
