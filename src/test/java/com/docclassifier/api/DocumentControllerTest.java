package com.docclassifier.api;

import com.docclassifier.TestDocumentFactory;
import com.docclassifier.processing.ClassificationJobWorker;
import com.docclassifier.shared.model.ClassificationJob;
import com.docclassifier.shared.repository.BatchJobRepository;
import com.docclassifier.shared.repository.ClassificationJobRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "app.messaging.mode=poll",
        "app.worker.poller-enabled=false",
        "app.upload.max-file-size-bytes=100000",
        "app.batch.max-size=2"
})
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ClassificationJobWorker worker;

    @Autowired
    private ClassificationJobRepository jobRepository;

    @Autowired
    private BatchJobRepository batchRepository;

    @BeforeEach
    void setUp() {
        jobRepository.deleteAll();
        batchRepository.deleteAll();
    }

    @Test
    void classifiesSynchronously() throws Exception {
        MockMultipartFile file = pdf("statement.pdf", "Monthly Statement", "Account 88-1", "Closing balance 10.00");

        mockMvc.perform(multipart("/api/documents/classify").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.document_type").value("bank_statement"))
                .andExpect(jsonPath("$.industry").value("financial"))
                .andExpect(jsonPath("$.metadata.classification_method").value("keyword_matching"))
                .andExpect(jsonPath("$.enhancement.tables_detected").value(0));
    }

    @Test
    void unsupportedFormatIs415() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.pdf", "application/pdf",
                "just some plain text".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/documents/classify").file(file))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_FORMAT"));
    }

    @Test
    void encryptedDocumentIs422() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "locked.pdf", "application/pdf",
                TestDocumentFactory.encryptedPdf("Statement"));

        mockMvc.perform(multipart("/api/documents/classify").file(file))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("EXTRACTION_FAILED"));
    }

    @Test
    void unknownIndustryIs400() throws Exception {
        MockMultipartFile file = pdf("statement.pdf", "Statement");

        mockMvc.perform(multipart("/api/documents/classify").file(file).param("industry", "aerospace"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_INDUSTRY"));
    }

    @Test
    void oversizedUploadIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "big.pdf", "application/pdf", new byte[100_001]);

        mockMvc.perform(multipart("/api/documents/classify").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("exceeds")));
    }

    @Test
    void asyncSubmissionReturnsStatusUrl() throws Exception {
        // Given / When
        MvcResult accepted = mockMvc.perform(multipart("/api/documents/classify/async")
                        .file(pdf("invoice.pdf", "INVOICE 7", "Amount due now", "Total 5.00"))
                        .header("X-Request-ID", "req-123"))
                .andExpect(status().isAccepted())
                .andExpect(header().string("X-Request-ID", "req-123"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andReturn();
        JsonNode body = objectMapper.readTree(accepted.getResponse().getContentAsString());
        UUID jobId = UUID.fromString(body.get("id").asText());
        assertThat(body.get("status_url").asText()).isEqualTo("/api/documents/jobs/" + jobId);

        mockMvc.perform(get("/api/documents/jobs/{id}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"));

        // Then: once processed the result is visible
        worker.process(jobId);
        mockMvc.perform(get("/api/documents/jobs/{id}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.result.document_type").value("invoice"));
    }

    @Test
    void unknownJobIs404() throws Exception {
        mockMvc.perform(get("/api/documents/jobs/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    @Test
    void batchSubmitStatusAndCancel() throws Exception {
        MvcResult accepted = mockMvc.perform(multipart("/api/documents/batches")
                        .file(pdfPart("files", "a.pdf", "Statement", "Account", "Balance"))
                        .file(pdfPart("files", "b.pdf", "Invoice", "Due", "Total"))
                        .param("industry", "financial"))
                .andExpect(status().isAccepted())
                .andReturn();
        UUID batchId = UUID.fromString(objectMapper.readTree(accepted.getResponse().getContentAsString())
                .get("id").asText());

        ClassificationJob first = jobRepository.findByBatchUuidOrderByBatchPositionAsc(batchId).get(0);
        worker.process(first.getJobUuid());

        mockMvc.perform(post("/api/documents/batches/{id}/cancel", batchId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(1));

        mockMvc.perform(get("/api/documents/batches/{id}", batchId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("PARTIAL"))
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.jobs[0].status").value("SUCCESS"))
                .andExpect(jsonPath("$.jobs[1].error.code").value("CANCELLED"));
    }

    @Test
    void batchOverTheSizeCapIs400() throws Exception {
        mockMvc.perform(multipart("/api/documents/batches")
                        .file(pdfPart("files", "a.pdf", "Statement"))
                        .file(pdfPart("files", "b.pdf", "Statement"))
                        .file(pdfPart("files", "c.pdf", "Statement")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("maximum of 2")));

        assertThat(batchRepository.count()).isZero();
    }

    @Test
    void retryResubmitsCancelledMembers() throws Exception {
        MvcResult accepted = mockMvc.perform(multipart("/api/documents/batches")
                        .file(pdfPart("files", "a.pdf", "Statement", "Account", "Balance")))
                .andExpect(status().isAccepted())
                .andReturn();
        UUID batchId = UUID.fromString(objectMapper.readTree(accepted.getResponse().getContentAsString())
                .get("id").asText());
        mockMvc.perform(post("/api/documents/batches/{id}/cancel", batchId))
                .andExpect(jsonPath("$.cancelled").value(1));

        mockMvc.perform(post("/api/documents/batches/{id}/retry", batchId))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.retried").value(1))
                .andExpect(jsonPath("$.status_url").value("/api/documents/batches/" + batchId));

        mockMvc.perform(get("/api/documents/batches/{id}", batchId))
                .andExpect(jsonPath("$.state").value("PENDING"))
                .andExpect(jsonPath("$.total").value(1));

        // nothing left to retry
        mockMvc.perform(post("/api/documents/batches/{id}/retry", batchId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.retried").value(0));
    }

    @Test
    void listsIndustriesAndFormats() throws Exception {
        mockMvc.perform(get("/api/documents/industries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].industry").value("financial"))
                .andExpect(jsonPath("$[1].industry").value("healthcare"));

        mockMvc.perform(get("/api/documents/formats").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['application/pdf']").value("PdfDocumentExtractor"));
    }

    private static MockMultipartFile pdf(String filename, String... lines) throws Exception {
        return pdfPart("file", filename, lines);
    }

    private static MockMultipartFile pdfPart(String part, String filename, String... lines) throws Exception {
        return new MockMultipartFile(part, filename, "application/pdf", TestDocumentFactory.pdf(lines));
    }
}
