package com.docclassifier.processing.extraction;

import com.docclassifier.processing.model.DocumentFormat;
import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.shared.exception.ExtractionFailedException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Set;

/**
 * Scanned images: decoded with ImageIO and read through the OCR engine.
 * A blank or unreadable scan fails extraction instead of yielding empty text.
 */
@Component
public class ImageDocumentExtractor extends AbstractDocumentExtractor {

    private final OcrEngine ocrEngine;
    private final int minOcrChars;

    public ImageDocumentExtractor(OcrEngine ocrEngine,
                                  @Value("${app.extraction.min-ocr-chars:10}") int minOcrChars) {
        this.ocrEngine = ocrEngine;
        this.minOcrChars = minOcrChars;
    }

    @Override
    public Set<String> supportedMediaTypes() {
        return Set.of("image/png", "image/jpeg", "image/tiff", "image/bmp");
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.IMAGE;
    }

    @Override
    protected ExtractedContent doExtract(byte[] content) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
        if (image == null) {
            throw new ExtractionFailedException("image could not be decoded");
        }
        if (!ocrEngine.isEnabled()) {
            throw new ExtractionFailedException("OCR is disabled; image text cannot be extracted");
        }

        String text = cleanText(ocrEngine.recognize(image));
        int recognised = countAlphanumeric(text);
        if (recognised < minOcrChars) {
            throw new ExtractionFailedException(
                    "OCR produced no usable text (" + recognised + " alphanumeric characters)");
        }

        return ExtractedContent.builder(DocumentFormat.IMAGE)
                .rawText(text)
                .pageCount(1)
                .property("width", image.getWidth())
                .property("height", image.getHeight())
                .property("ocr_applied", true)
                .build();
    }
}
