package com.accessibility.checker.service.analysis;

import com.accessibility.checker.dto.LabelDetection;
import com.accessibility.checker.exception.ImageAnalysisException;
import com.accessibility.checker.model.ImageRef;

/**
 * Client of the external image-understanding service.
 */
public interface ImageLabelDetector {

    /**
     * Detects labels in one stored image.
     *
     * @return the raw detection, labels in service order
     * @throws ImageAnalysisException when the image cannot be analyzed; its kind tells
     *                                whether the call is worth retrying
     */
    LabelDetection detectLabels(ImageRef image) throws ImageAnalysisException;
}
