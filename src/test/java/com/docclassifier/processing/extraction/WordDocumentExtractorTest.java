package com.docclassifier.processing.extraction;

import com.docclassifier.TestDocumentFactory;
import com.docclassifier.processing.model.DocumentFormat;
import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.shared.exception.ExtractionFailedException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordDocumentExtractorTest {

    private final WordDocumentExtractor extractor = new WordDocumentExtractor();

    @Test
    void extractsParagraphsTablesHeadersAndFooters() throws Exception {
        byte[] docx = TestDocumentFactory.docx(
                List.of("Invoice 2024-117", "Payment terms: 30 days"),
                List.of(List.of("Description", "Amount"), List.of("Consulting", "1200.00")),
                "ACME Corp", "Page 1");

        ExtractedContent content = extractor.extract(docx);

        assertThat(content.getFormat()).isEqualTo(DocumentFormat.WORD);
        assertThat(content.getMediaType()).isEqualTo(MediaTypeDetector.DOCX);
        assertThat(content.getRawText()).contains("Invoice 2024-117").contains("Consulting 1200.00");
        assertThat(content.getTables()).hasSize(1);
        assertThat(content.getTables().get(0).getFirstRow()).containsExactly("Description", "Amount");
        assertThat(content.getHeaders()).contains("ACME Corp");
        assertThat(content.getFooters()).contains("Page 1");
        assertThat(content.getProperty("paragraph_count")).isEqualTo(2);
    }

    @Test
    void emptyDocumentFailsExtraction() throws Exception {
        byte[] docx = TestDocumentFactory.docx(List.of(), null, null, null);

        assertThatThrownBy(() -> extractor.extract(docx))
                .isInstanceOf(ExtractionFailedException.class);
    }

    @Test
    void truncatedDocumentFailsExtraction() throws Exception {
        byte[] docx = TestDocumentFactory.docx(List.of("Some text here"), null, null, null);
        byte[] truncated = java.util.Arrays.copyOf(docx, docx.length / 3);

        assertThatThrownBy(() -> extractor.extract(truncated))
                .isInstanceOf(ExtractionFailedException.class);
    }
}
