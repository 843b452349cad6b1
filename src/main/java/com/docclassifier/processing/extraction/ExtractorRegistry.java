package com.docclassifier.processing.extraction;

import com.docclassifier.shared.exception.ExtractionFailedException;
import com.docclassifier.shared.exception.ExtractorConflictException;
import com.docclassifier.shared.exception.UnsupportedFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps sniffed media types to extractors. Populated once at startup and then sealed; lookups
 * read an immutable snapshot and need no locking.
 */
public class ExtractorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ExtractorRegistry.class);

    private final MediaTypeDetector detector;
    private final Map<String, DocumentExtractor> byMediaType = new LinkedHashMap<>();
    private volatile Map<String, DocumentExtractor> snapshot = Map.of();
    private volatile boolean sealed;

    public ExtractorRegistry(MediaTypeDetector detector) {
        this.detector = detector;
    }

    /**
     * Registers the extractor under each media type it declares.
     *
     * @throws ExtractorConflictException if another extractor already claims one of the types
     * @throws IllegalStateException if the registry has been sealed
     */
    public synchronized void register(DocumentExtractor extractor) {
        if (sealed) {
            throw new IllegalStateException("Extractor registry is sealed; cannot register " + extractor.name());
        }
        for (String mediaType : extractor.supportedMediaTypes()) {
            DocumentExtractor existing = byMediaType.get(mediaType);
            if (existing != null && existing != extractor) {
                throw new ExtractorConflictException(mediaType, existing.name(), extractor.name());
            }
        }
        for (String mediaType : extractor.supportedMediaTypes()) {
            byMediaType.put(mediaType, extractor);
        }
        snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(byMediaType));
        logger.info("Registered extractor {} for {}", extractor.name(), extractor.supportedMediaTypes());
    }

    public synchronized void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Sniffs the media type of a document. The result can be passed to {@link #resolveMediaType}.
     *
     * @throws ExtractionFailedException for empty or password protected Office documents
     */
    public String detectMediaType(byte[] content) {
        if (content == null || content.length == 0) {
            throw new ExtractionFailedException("document is empty (0 bytes)");
        }
        String mediaType = detector.detect(content);
        if (MediaTypeDetector.ENCRYPTED_OOXML.equals(mediaType)) {
            throw new ExtractionFailedException("document is password protected");
        }
        return mediaType;
    }

    /**
     * Selects the extractor for the document's sniffed media type.
     *
     * @throws ExtractionFailedException for empty or password protected Office documents
     * @throws UnsupportedFormatException when no extractor handles the detected type
     */
    public DocumentExtractor resolve(byte[] content) {
        return resolveMediaType(detectMediaType(content));
    }

    /**
     * @throws UnsupportedFormatException when no extractor handles the media type
     */
    public DocumentExtractor resolveMediaType(String mediaType) {
        DocumentExtractor extractor = snapshot.get(mediaType);
        if (extractor == null) {
            throw new UnsupportedFormatException(mediaType);
        }
        return extractor;
    }

    /**
     * Supported media types mapped to the name of the extractor handling them.
     */
    public Map<String, String> supportedMediaTypes() {
        Map<String, String> result = new LinkedHashMap<>();
        snapshot.forEach((mediaType, extractor) -> result.put(mediaType, extractor.name()));
        return result;
    }
}
