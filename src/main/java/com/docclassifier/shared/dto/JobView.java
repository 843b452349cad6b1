package com.docclassifier.shared.dto;

import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.shared.model.ErrorInfo;
import com.docclassifier.shared.model.JobState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a classification job. Carries a result only in SUCCESS and an error
 * only in FAILURE.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobView {

    private final UUID jobId;
    private final JobState status;
    private final UUID batchId;
    private final String filename;
    private final String mediaType;
    private final ClassificationResult result;
    private final ErrorInfo error;
    private final int attempts;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    public JobView(UUID jobId, JobState status, UUID batchId, String filename, String mediaType,
                   ClassificationResult result, ErrorInfo error, int attempts,
                   Instant createdAt, Instant startedAt, Instant finishedAt) {
        this.jobId = jobId;
        this.status = status;
        this.batchId = batchId;
        this.filename = filename;
        this.mediaType = mediaType;
        this.result = result;
        this.error = error;
        this.attempts = attempts;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    @JsonProperty("job_id")
    public UUID getJobId() {
        return jobId;
    }

    @JsonProperty("status")
    public JobState getStatus() {
        return status;
    }

    @JsonProperty("batch_id")
    public UUID getBatchId() {
        return batchId;
    }

    @JsonProperty("filename")
    public String getFilename() {
        return filename;
    }

    @JsonProperty("media_type")
    public String getMediaType() {
        return mediaType;
    }

    @JsonProperty("result")
    public ClassificationResult getResult() {
        return result;
    }

    @JsonProperty("error")
    public ErrorInfo getError() {
        return error;
    }

    @JsonProperty("attempts")
    public int getAttempts() {
        return attempts;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("started_at")
    public Instant getStartedAt() {
        return startedAt;
    }

    @JsonProperty("finished_at")
    public Instant getFinishedAt() {
        return finishedAt;
    }
}
