package com.docclassifier.processing.extraction;

import com.docclassifier.processing.model.DocumentFormat;
import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.shared.exception.ExtractionFailedException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripperByArea;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Set;

/**
 * PDF text extraction with PDFBox. Headers and footers are read from the top and bottom bands
 * of every page; column-aligned lines are lifted out as tables. Pages are rendered and passed to OCR when the text layer is missing or
 * mostly non-alphanumeric.
 */
@Component
public class PdfDocumentExtractor extends AbstractDocumentExtractor {

    private static final float BAND_RATIO = 0.10f;
    private static final double MIN_ALNUM_RATIO = 0.1;
    private static final int MAX_FORM_DEPTH = 5;

    private final OcrEngine ocrEngine;
    private final int renderDpi;

    public PdfDocumentExtractor(OcrEngine ocrEngine,
                                @Value("${app.ocr.render-dpi:300}") int renderDpi) {
        this.ocrEngine = ocrEngine;
        this.renderDpi = renderDpi;
    }

    @Override
    public Set<String> supportedMediaTypes() {
        return Set.of(MediaTypeDetector.PDF);
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PDF;
    }

    @Override
    protected ExtractedContent doExtract(byte[] content) throws IOException {
        try (PDDocument document = load(content)) {
            if (document.isEncrypted()) {
                throw new ExtractionFailedException("PDF is encrypted");
            }

            int pageCount = document.getNumberOfPages();
            ExtractedContent.Builder builder = ExtractedContent.builder(DocumentFormat.PDF)
                    .mediaType(MediaTypeDetector.PDF)
                    .pageCount(pageCount)
                    .property("encrypted", false);

            PdfTableStripper stripper = new PdfTableStripper();
            StringBuilder text = new StringBuilder();
            int embeddedImages = 0;
            for (int pageNum = 1; pageNum <= pageCount; pageNum++) {
                stripper.setStartPage(pageNum);
                stripper.setEndPage(pageNum);
                text.append(stripper.getText(document)).append('\n');

                PDPage page = document.getPage(pageNum - 1);
                readBands(page, builder);
                embeddedImages += countImages(page.getResources(), 0);
            }

            stripper.getTables().forEach(builder::addTable);

            String rawText = cleanText(text.toString());
            if (needsOcr(rawText) && ocrEngine.isEnabled() && pageCount > 0) {
                logger.info("PDF text layer is unusable ({} chars), falling back to OCR for {} pages",
                        rawText.length(), pageCount);
                rawText = cleanText(ocrPages(document, pageCount));
                builder.property("ocr_applied", true);
            } else {
                builder.property("ocr_applied", false);
            }

            PDDocumentInformation info = document.getDocumentInformation();
            if (info != null) {
                builder.property("title", info.getTitle())
                        .property("author", info.getAuthor())
                        .property("producer", info.getProducer());
            }

            return builder.rawText(rawText)
                    .property("embedded_images", embeddedImages)
                    .build();
        }
    }

    private static PDDocument load(byte[] content) throws IOException {
        try {
            return Loader.loadPDF(content);
        } catch (InvalidPasswordException e) {
            throw new ExtractionFailedException("PDF is password protected", e);
        }
    }

    private void readBands(PDPage page, ExtractedContent.Builder builder) throws IOException {
        PDRectangle box = page.getCropBox();
        float width = box.getWidth();
        float height = box.getHeight();
        float band = height * BAND_RATIO;

        PDFTextStripperByArea areaStripper = new PDFTextStripperByArea();
        areaStripper.addRegion("header", new Rectangle2D.Float(0, 0, width, band));
        areaStripper.addRegion("footer", new Rectangle2D.Float(0, height - band, width, band));
        areaStripper.extractRegions(page);

        builder.addHeader(cleanText(areaStripper.getTextForRegion("header")));
        builder.addFooter(cleanText(areaStripper.getTextForRegion("footer")));
    }

    private int countImages(PDResources resources, int depth) throws IOException {
        if (resources == null || depth > MAX_FORM_DEPTH) {
            return 0;
        }
        int count = 0;
        for (COSName name : resources.getXObjectNames()) {
            PDXObject xObject = resources.getXObject(name);
            if (xObject instanceof PDImageXObject) {
                count++;
            } else if (xObject instanceof PDFormXObject) {
                count += countImages(((PDFormXObject) xObject).getResources(), depth + 1);
            }
        }
        return count;
    }

    static boolean needsOcr(String text) {
        if (text == null || text.isBlank()) {
            return true;
        }
        return (double) countAlphanumeric(text) / text.length() < MIN_ALNUM_RATIO;
    }

    private String ocrPages(PDDocument document, int pageCount) throws IOException {
        PDFRenderer renderer = new PDFRenderer(document);
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < pageCount; i++) {
            BufferedImage image = renderer.renderImageWithDPI(i, renderDpi, ImageType.GRAY);
            text.append(ocrEngine.recognize(image)).append('\n');
        }
        return text.toString();
    }
}
