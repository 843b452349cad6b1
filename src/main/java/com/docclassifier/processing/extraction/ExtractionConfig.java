package com.docclassifier.processing.extraction;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the extractor registry from every {@link DocumentExtractor} bean and seals it.
 */
@Configuration
public class ExtractionConfig {

    @Bean
    public ExtractorRegistry extractorRegistry(MediaTypeDetector detector, List<DocumentExtractor> extractors) {
        ExtractorRegistry registry = new ExtractorRegistry(detector);
        extractors.forEach(registry::register);
        registry.seal();
        return registry;
    }
}
