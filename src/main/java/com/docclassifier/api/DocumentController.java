package com.docclassifier.api;

import com.docclassifier.processing.DocumentClassificationFacade;
import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.processing.model.DocumentSubmission;
import com.docclassifier.shared.dto.BatchStatus;
import com.docclassifier.shared.dto.JobView;
import com.docclassifier.shared.dto.SubmissionResponse;
import com.docclassifier.shared.exception.InfrastructureException;
import com.docclassifier.shared.model.JobState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/documents")
@Tag(name = "Documents", description = "Document classification, job and batch endpoints")
public class DocumentController {

    private static final Logger logger = LoggerFactory.getLogger(DocumentController.class);

    private final DocumentClassificationFacade facade;
    private final long maxFileSizeBytes;
    private final int maxBatchSize;

    public DocumentController(DocumentClassificationFacade facade,
                              @Value("${app.upload.max-file-size-bytes:52428800}") long maxFileSizeBytes,
                              @Value("${app.batch.max-size:100}") int maxBatchSize) {
        this.facade = facade;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.maxBatchSize = maxBatchSize;
    }

    @PostMapping(value = "/classify", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Classify a document synchronously",
               description = "Extracts, classifies and enhances the document in the request thread")
    public ResponseEntity<ClassificationResult> classify(
            @Parameter(description = "Document to classify (PDF, DOC, DOCX, XLS, XLSX or image)")
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Optional industry hint, e.g. financial")
            @RequestParam(value = "industry", required = false) String industry) {
        DocumentSubmission submission = toSubmission(file, industry);
        return ResponseEntity.ok(facade.classifySync(submission));
    }

    @PostMapping(value = "/classify/async", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Submit a document for background classification",
               description = "Returns a job id immediately; poll the status URL for the result")
    public ResponseEntity<SubmissionResponse> classifyAsync(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "industry", required = false) String industry) {
        UUID jobId = facade.classifyAsync(toSubmission(file, industry));
        logger.info("Accepted async classification job {}", jobId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new SubmissionResponse(jobId, JobState.PENDING.name(), "/api/documents/jobs/" + jobId));
    }

    @GetMapping("/jobs/{id}")
    @Operation(summary = "Get job status and result")
    public ResponseEntity<JobView> getJob(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(facade.getStatus(id));
    }

    @PostMapping(value = "/batches", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Submit a batch of documents",
               description = "Each file becomes one job; the batch state is derived from its members")
    public ResponseEntity<SubmissionResponse> submitBatch(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(value = "industry", required = false) String industry) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one file");
        }
        // checked before any file content is read into memory
        if (files.size() > maxBatchSize) {
            throw new IllegalArgumentException(String.format("Batch size (%d) exceeds maximum of %d documents",
                    files.size(), maxBatchSize));
        }
        List<DocumentSubmission> submissions = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            submissions.add(toSubmission(file, null));
        }
        UUID batchId = facade.submitBatch(submissions, industry);
        logger.info("Accepted batch {} with {} documents", batchId, submissions.size());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new SubmissionResponse(batchId, JobState.PENDING.name(), "/api/documents/batches/" + batchId));
    }

    @GetMapping("/batches/{id}")
    @Operation(summary = "Get batch status with per-member results")
    public ResponseEntity<BatchStatus> getBatch(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(facade.getBatchStatus(id));
    }

    @PostMapping("/batches/{id}/cancel")
    @Operation(summary = "Cancel the members of a batch that have not started yet")
    public ResponseEntity<Map<String, Object>> cancelBatch(@PathVariable("id") UUID id) {
        int cancelled = facade.cancelBatch(id);
        Map<String, Object> response = new HashMap<>();
        response.put("batch_id", id.toString());
        response.put("cancelled", cancelled);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/batches/{id}/retry")
    @Operation(summary = "Resubmit the failed and cancelled members of a batch",
               description = "Each resubmitted member gets a new job id at its original position")
    public ResponseEntity<Map<String, Object>> retryBatch(@PathVariable("id") UUID id) {
        int retried = facade.retryBatch(id);
        Map<String, Object> response = new HashMap<>();
        response.put("batch_id", id.toString());
        response.put("retried", retried);
        response.put("status_url", "/api/documents/batches/" + id);
        return ResponseEntity.status(retried > 0 ? HttpStatus.ACCEPTED : HttpStatus.OK).body(response);
    }

    @GetMapping("/industries")
    @Operation(summary = "List registered industries and their document types")
    public ResponseEntity<List<Map<String, Object>>> industries() {
        return ResponseEntity.ok(facade.industries());
    }

    @GetMapping("/formats")
    @Operation(summary = "List supported media types and the extractor handling each")
    public ResponseEntity<Map<String, String>> formats() {
        return ResponseEntity.ok(facade.supportedMediaTypes());
    }

    private DocumentSubmission toSubmission(MultipartFile file, String industry) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is empty");
        }
        if (file.getSize() > maxFileSizeBytes) {
            throw new IllegalArgumentException(
                    String.format("File size (%d bytes) exceeds maximum allowed size (%d bytes)",
                            file.getSize(), maxFileSizeBytes));
        }
        try {
            return new DocumentSubmission(file.getOriginalFilename(), file.getBytes(), industry);
        } catch (IOException e) {
            throw new InfrastructureException("Failed to read uploaded file", e);
        }
    }
}
