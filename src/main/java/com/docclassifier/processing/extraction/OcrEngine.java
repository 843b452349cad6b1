package com.docclassifier.processing.extraction;

import java.awt.image.BufferedImage;

/**
 * Optical character recognition over a decoded image.
 */
public interface OcrEngine {

    boolean isEnabled();

    /**
     * @return recognised text, empty when nothing was recognised
     * @throws com.docclassifier.shared.exception.ExtractionFailedException if the engine fails
     */
    String recognize(BufferedImage image);
}
