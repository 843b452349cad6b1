package com.docclassifier.processing;

import com.docclassifier.api.storage.StorageService;
import com.docclassifier.observability.ClassificationMetrics;
import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.processing.model.DocumentFormat;
import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.processing.model.PipelineResult;
import com.docclassifier.shared.exception.ExtractionFailedException;
import com.docclassifier.shared.model.ClassificationJob;
import com.docclassifier.shared.model.ErrorCode;
import com.docclassifier.shared.model.JobState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClassificationJobWorkerTest {

    private static final String STORAGE_PATH = "local://job/statement.pdf";
    private static final byte[] DOCUMENT = {37, 80, 68, 70};

    @Mock
    private JobClaimService claimService;

    @Mock
    private ClassificationPipeline pipeline;

    @Mock
    private StorageService storageService;

    @Mock
    private ClassificationMetrics metrics;

    private ClassificationJobWorker worker;
    private UUID jobId;

    @BeforeEach
    void setUp() {
        worker = new ClassificationJobWorker(claimService, pipeline, storageService, metrics, new ObjectMapper());
        worker.setRetryPolicy(3, 1);
        jobId = UUID.randomUUID();
    }

    @Test
    void transientStorageErrorsAreRetried() throws Exception {
        // Given: storage fails twice before returning the document
        when(claimService.claim(jobId)).thenReturn(Optional.of(claimedJob()));
        when(storageService.load(STORAGE_PATH))
                .thenThrow(new IOException("disk busy"))
                .thenThrow(new IOException("disk busy"))
                .thenReturn(DOCUMENT);
        when(pipeline.run(DOCUMENT, null)).thenReturn(successfulRun());
        when(claimService.complete(eq(jobId), anyInt(), anyString(), eq("invoice"), anyDouble(), eq("application/pdf")))
                .thenReturn(true);

        // When
        worker.process(jobId);

        // Then
        verify(storageService, times(3)).load(STORAGE_PATH);
        verify(metrics).recordJobOutcome(JobState.SUCCESS, null);
        verify(storageService).delete(STORAGE_PATH);
    }

    @Test
    void exhaustedStorageRetriesFailWithInfrastructure() throws Exception {
        when(claimService.claim(jobId)).thenReturn(Optional.of(claimedJob()));
        when(storageService.load(STORAGE_PATH)).thenThrow(new IOException("bucket unavailable"));
        when(claimService.fail(eq(jobId), anyInt(), eq(ErrorCode.INFRASTRUCTURE), anyString(), isNull()))
                .thenReturn(true);

        worker.process(jobId);

        verify(storageService, times(3)).load(STORAGE_PATH);
        verifyNoInteractions(pipeline);
        verify(metrics).recordJobOutcome(JobState.FAILURE, ErrorCode.INFRASTRUCTURE);
    }

    @Test
    void documentErrorsAreNotRetried() throws Exception {
        when(claimService.claim(jobId)).thenReturn(Optional.of(claimedJob()));
        when(storageService.load(STORAGE_PATH)).thenReturn(DOCUMENT);
        when(pipeline.run(DOCUMENT, null)).thenThrow(new ExtractionFailedException("PDF is encrypted"));
        when(claimService.fail(eq(jobId), anyInt(), eq(ErrorCode.EXTRACTION_FAILED),
                startsWith("Extraction failed"), isNull())).thenReturn(true);

        worker.process(jobId);

        verify(pipeline, times(1)).run(DOCUMENT, null);
        verify(claimService, never()).complete(any(), anyInt(), any(), any(), anyDouble(), any());
        verify(metrics).recordJobOutcome(JobState.FAILURE, ErrorCode.EXTRACTION_FAILED);
        // kept for batch retry
        verify(storageService, never()).delete(any());
    }

    @Test
    void unclaimableJobIsLeftAlone() throws Exception {
        when(claimService.claim(jobId)).thenReturn(Optional.empty());

        worker.process(jobId);

        verifyNoInteractions(storageService, pipeline, metrics);
    }

    @Test
    void lostClaimDoesNotRecordOutcome() throws Exception {
        // Given: the reaper failed the job while the pipeline ran
        when(claimService.claim(jobId)).thenReturn(Optional.of(claimedJob()));
        when(storageService.load(STORAGE_PATH)).thenReturn(DOCUMENT);
        when(pipeline.run(DOCUMENT, null)).thenReturn(successfulRun());
        when(claimService.complete(eq(jobId), anyInt(), anyString(), anyString(), anyDouble(), anyString()))
                .thenReturn(false);

        worker.process(jobId);

        verifyNoInteractions(metrics);
        verify(storageService, never()).delete(any());
    }

    private ClassificationJob claimedJob() {
        ClassificationJob job = new ClassificationJob(jobId);
        job.setStatus(JobState.RUNNING);
        job.setFilename("statement.pdf");
        job.setStoragePath(STORAGE_PATH);
        return job;
    }

    private static PipelineResult successfulRun() {
        ExtractedContent content = ExtractedContent.builder(DocumentFormat.PDF).rawText("invoice total due").build();
        ClassificationResult result = new ClassificationResult("invoice", "financial", 0.5,
                Map.of("invoice", 3), Map.of("classification_method", "keyword_matching"), null);
        return new PipelineResult("application/pdf", content, result);
    }
}
