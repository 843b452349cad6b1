package com.docclassifier.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Value("${app.upload.max-file-size-bytes:52428800}")
    private long maxFileSizeBytes;

    @Bean
    public OpenAPI documentClassifierOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Document Classifier API")
                        .version("1.0.0")
                        .description("Classifies PDF, Word, Excel and image documents into industry document types. "
                                + "Uploads are limited to " + (maxFileSizeBytes / (1024 * 1024)) + " MB per file. "
                                + "Async and batch submissions return a status_url to poll."));
    }

    // Actuator endpoints stay out of the published contract.
    @Bean
    public GroupedOpenApi documentsApi() {
        return GroupedOpenApi.builder()
                .group("documents")
                .pathsToMatch("/api/documents/**")
                .build();
    }
}
