package com.docclassifier.processing.extraction;

import com.docclassifier.TestDocumentFactory;
import com.docclassifier.processing.model.DocumentFormat;
import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.shared.exception.ExtractionFailedException;
import com.docclassifier.shared.exception.ExtractorConflictException;
import com.docclassifier.shared.exception.UnsupportedFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractorRegistryTest {

    private ExtractorRegistry registry;
    private PdfDocumentExtractor pdfExtractor;

    @BeforeEach
    void setUp() {
        StubOcrEngine ocr = StubOcrEngine.disabled();
        pdfExtractor = new PdfDocumentExtractor(ocr, 150);
        registry = new ExtractorRegistry(new MediaTypeDetector());
        registry.register(pdfExtractor);
        registry.register(new WordDocumentExtractor());
        registry.register(new ExcelDocumentExtractor());
        registry.register(new ImageDocumentExtractor(ocr, 10));
    }

    @Test
    void resolvesExtractorFromContentNotFilename() throws Exception {
        byte[] pdf = TestDocumentFactory.pdf("Account statement");

        assertThat(registry.resolve(pdf)).isSameAs(pdfExtractor);
    }

    @Test
    void detectedMediaTypeSelectsExtractorWithoutSniffingAgain() throws Exception {
        byte[] pdf = TestDocumentFactory.pdf("Invoice total due");

        String mediaType = registry.detectMediaType(pdf);

        assertThat(mediaType).isEqualTo(MediaTypeDetector.PDF);
        assertThat(registry.resolveMediaType(mediaType)).isSameAs(pdfExtractor);
    }

    @Test
    void unknownMediaTypeIsUnsupported() {
        byte[] text = "plain text notes, nothing more".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> registry.resolve(text))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void emptyInputFailsExtractionRatherThanFormatCheck() {
        assertThatThrownBy(() -> registry.resolve(new byte[0]))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> registry.detectMediaType(new byte[0]))
                .isInstanceOf(ExtractionFailedException.class);
    }

    @Test
    void passwordProtectedOfficeFileFailsExtraction() throws Exception {
        byte[] encrypted = TestDocumentFactory.encryptedXlsx("Data", List.of(List.of("a", "b")));

        assertThatThrownBy(() -> registry.resolve(encrypted))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessageContaining("password");
    }

    @Test
    void conflictingRegistrationIsRejected() {
        DocumentExtractor rival = new FixedExtractor(Set.of(MediaTypeDetector.PDF));

        assertThatThrownBy(() -> registry.register(rival))
                .isInstanceOf(ExtractorConflictException.class);
        assertThat(registry.resolveMediaType(MediaTypeDetector.PDF)).isSameAs(pdfExtractor);
    }

    @Test
    void sealedRegistryRefusesRegistration() {
        registry.seal();

        assertThat(registry.isSealed()).isTrue();
        assertThatThrownBy(() -> registry.register(new FixedExtractor(Set.of("text/csv"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void listsSupportedMediaTypesWithExtractorNames() {
        assertThat(registry.supportedMediaTypes())
                .containsEntry(MediaTypeDetector.PDF, "PdfDocumentExtractor")
                .containsEntry(MediaTypeDetector.XLS, "ExcelDocumentExtractor")
                .containsEntry(MediaTypeDetector.DOCX, "WordDocumentExtractor")
                .containsKey("image/png");
    }

    private static final class FixedExtractor implements DocumentExtractor {
        private final Set<String> mediaTypes;

        FixedExtractor(Set<String> mediaTypes) {
            this.mediaTypes = mediaTypes;
        }

        @Override
        public Set<String> supportedMediaTypes() {
            return mediaTypes;
        }

        @Override
        public DocumentFormat format() {
            return DocumentFormat.PDF;
        }

        @Override
        public ExtractedContent extract(byte[] content) {
            return ExtractedContent.builder(DocumentFormat.PDF).rawText("fixed").build();
        }
    }
}
