package com.docclassifier.processing.extraction;

import com.docclassifier.shared.exception.ExtractionFailedException;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Tesseract OCR through Tess4J. Disabled with {@code app.ocr.enabled=false}, in which case
 * image documents cannot be extracted and PDFs skip the OCR fallback.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger logger = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final ITesseract tesseract;
    private final boolean enabled;

    public TesseractOcrEngine(@Value("${app.ocr.enabled:true}") boolean enabled,
                              @Value("${app.ocr.language:eng}") String language,
                              @Value("${app.ocr.datapath:}") String datapath) {
        this.enabled = enabled;
        if (enabled) {
            Tesseract engine = new Tesseract();
            if (datapath != null && !datapath.isBlank()) {
                engine.setDatapath(datapath);
            }
            if (language != null && !language.isBlank()) {
                engine.setLanguage(language);
            }
            this.tesseract = engine;
            logger.info("Tesseract OCR enabled (language={})", language);
        } else {
            this.tesseract = null;
            logger.info("OCR disabled");
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String recognize(BufferedImage image) {
        if (!enabled) {
            throw new ExtractionFailedException("OCR is disabled");
        }
        try {
            String result = tesseract.doOCR(image);
            return result == null ? "" : result.trim();
        } catch (TesseractException e) {
            logger.warn("OCR failed: {}", e.getMessage());
            throw new ExtractionFailedException("OCR failed: " + e.getMessage(), e);
        } catch (UnsatisfiedLinkError e) {
            logger.error("Tesseract native library is not available", e);
            throw new ExtractionFailedException("OCR engine unavailable", e);
        }
    }
}
