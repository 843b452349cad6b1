package com.docclassifier.processing.extraction;

import com.docclassifier.TestDocumentFactory;
import com.docclassifier.processing.model.ContentTable;
import com.docclassifier.processing.model.DocumentFormat;
import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.shared.exception.ExtractionFailedException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfDocumentExtractorTest {

    @Test
    void extractsTextPagesAndProperties() throws Exception {
        // Given: a one-page PDF with a text layer
        PdfDocumentExtractor extractor = new PdfDocumentExtractor(StubOcrEngine.disabled(), 150);
        byte[] pdf = TestDocumentFactory.pdf("Monthly Statement", "Account 1234", "Closing balance 10.00");

        // When
        ExtractedContent content = extractor.extract(pdf);

        // Then
        assertThat(content.getFormat()).isEqualTo(DocumentFormat.PDF);
        assertThat(content.getMediaType()).isEqualTo(MediaTypeDetector.PDF);
        assertThat(content.getPageCount()).isEqualTo(1);
        assertThat(content.getRawText()).contains("Monthly Statement").contains("Closing balance 10.00");
        assertThat(content.getProperty("ocr_applied")).isEqualTo(false);
        assertThat(content.getProperty("encrypted")).isEqualTo(false);
        assertThat(content.getProperty("embedded_images")).isEqualTo(0);
    }

    @Test
    void readsHeaderAndFooterBands() throws Exception {
        PdfDocumentExtractor extractor = new PdfDocumentExtractor(StubOcrEngine.disabled(), 150);
        byte[] pdf = TestDocumentFactory.pdfWithMargins("ACME Bank Confidential", "Body of the letter", "Page 1 of 1");

        ExtractedContent content = extractor.extract(pdf);

        assertThat(content.getHeaders()).anySatisfy(h -> assertThat(h).contains("ACME Bank Confidential"));
        assertThat(content.getFooters()).anySatisfy(f -> assertThat(f).contains("Page 1 of 1"));
    }

    @Test
    void liftsColumnAlignedRowsIntoATable() throws Exception {
        // Given: a heading above three rows laid out in three columns
        PdfDocumentExtractor extractor = new PdfDocumentExtractor(StubOcrEngine.disabled(), 150);
        byte[] pdf = TestDocumentFactory.pdfTable("Account Activity", List.of(
                List.of("Date", "Description", "Amount"),
                List.of("2024-01-03", "Card payment", "12.50"),
                List.of("2024-01-09", "Salary", "2,400.00")));

        // When
        ExtractedContent content = extractor.extract(pdf);

        // Then
        assertThat(content.getTables()).hasSize(1);
        ContentTable table = content.getTables().get(0);
        assertThat(table.getRowCount()).isEqualTo(3);
        assertThat(table.getColumnCount()).isEqualTo(3);
        assertThat(table.getFirstRow()).containsExactly("Date", "Description", "Amount");
        assertThat(table.getRows().get(1)).containsExactly("2024-01-03", "Card payment", "12.50");
        assertThat(content.getRawText()).contains("Account Activity").contains("Salary");
    }

    @Test
    void proseIsNotMistakenForATable() throws Exception {
        PdfDocumentExtractor extractor = new PdfDocumentExtractor(StubOcrEngine.disabled(), 150);
        byte[] pdf = TestDocumentFactory.pdf("Monthly Statement", "Account 1234", "Closing balance 10.00");

        assertThat(extractor.extract(pdf).getTables()).isEmpty();
    }

    @Test
    void documentInformationBecomesProperties() throws Exception {
        PdfDocumentExtractor extractor = new PdfDocumentExtractor(StubOcrEngine.disabled(), 150);
        byte[] pdf = TestDocumentFactory.pdfWithInfo("March Statement", "ACME Bank", "StatementWriter 2.1",
                "Monthly Statement");

        ExtractedContent content = extractor.extract(pdf);

        assertThat(content.getProperty("title")).isEqualTo("March Statement");
        assertThat(content.getProperty("author")).isEqualTo("ACME Bank");
        assertThat(content.getProperty("producer")).isEqualTo("StatementWriter 2.1");
    }

    @Test
    void encryptedPdfFailsExtraction() throws Exception {
        PdfDocumentExtractor extractor = new PdfDocumentExtractor(StubOcrEngine.disabled(), 150);
        byte[] pdf = TestDocumentFactory.encryptedPdf("Secret statement");

        assertThatThrownBy(() -> extractor.extract(pdf))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessageContaining("password");
    }

    @Test
    void corruptPdfFailsExtraction() {
        PdfDocumentExtractor extractor = new PdfDocumentExtractor(StubOcrEngine.disabled(), 150);
        byte[] corrupt = "%PDF-1.7\nthis is not really a pdf".getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> extractor.extract(corrupt))
                .isInstanceOf(ExtractionFailedException.class);
    }

    @Test
    void scannedPdfWithoutOcrFailsInsteadOfReturningEmptyText() throws Exception {
        PdfDocumentExtractor extractor = new PdfDocumentExtractor(StubOcrEngine.disabled(), 150);

        assertThatThrownBy(() -> extractor.extract(TestDocumentFactory.blankPdf()))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessageContaining("no extractable text");
    }

    @Test
    void scannedPdfFallsBackToOcr() throws Exception {
        // Given: a PDF without a text layer and an OCR engine that can read it
        StubOcrEngine ocr = StubOcrEngine.returning("DRIVER LICENSE\nLicense Number D123");
        PdfDocumentExtractor extractor = new PdfDocumentExtractor(ocr, 72);

        // When
        ExtractedContent content = extractor.extract(TestDocumentFactory.blankPdf());

        // Then
        assertThat(ocr.getCalls()).isEqualTo(1);
        assertThat(content.getRawText()).contains("License Number D123");
        assertThat(content.getProperty("ocr_applied")).isEqualTo(true);
    }

    @Test
    void needsOcrForSymbolOnlyText() {
        assertThat(PdfDocumentExtractor.needsOcr("")).isTrue();
        assertThat(PdfDocumentExtractor.needsOcr(". . . . . . . . . . . . . . . . . . . . . . . .")).isTrue();
        assertThat(PdfDocumentExtractor.needsOcr("Invoice total due")).isFalse();
    }
}
