package com.docclassifier.shared.model;

import com.docclassifier.util.Strings;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One document's classification job.
 * Maps to the classification_jobs table. Jobs are inserted PENDING, or FAILURE when their upload
 * could not be stored. Later state changes go through the conditional updates in
 * {@link com.docclassifier.shared.repository.ClassificationJobRepository}, never through save().
 */
@Entity
@Table(name = "classification_jobs", indexes = {
    @Index(name = "idx_job_uuid", columnList = "job_uuid"),
    @Index(name = "idx_job_status_created", columnList = "status, created_at"),
    @Index(name = "idx_job_batch", columnList = "batch_uuid, batch_position")
})
public class ClassificationJob {

    public static final int MAX_ERROR_MESSAGE_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_uuid", nullable = false, unique = true, updatable = false)
    @NotNull
    private UUID jobUuid;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobState status = JobState.PENDING;

    @Column(name = "industry", length = 50)
    @Size(max = 50)
    private String industry;

    @Column(name = "filename", length = 255)
    @Size(max = 255)
    private String filename;

    @Column(name = "media_type", length = 150)
    private String mediaType;

    @Column(name = "file_size_bytes")
    private Long fileSizeBytes;

    @Column(name = "storage_path", length = 500)
    private String storagePath;

    @Column(name = "batch_uuid")
    private UUID batchUuid;

    @Column(name = "batch_position")
    private Integer batchPosition;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "document_type", length = 100)
    private String documentType;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "result_json", length = 1_000_000)
    private String resultJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code", length = 40)
    private ErrorCode errorCode;

    @Column(name = "error_message", length = MAX_ERROR_MESSAGE_LENGTH)
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // set on a failed batch member once a retry job replaces it
    @Column(name = "retried_as")
    private UUID retriedAs;

    public ClassificationJob() {
        this.jobUuid = UUID.randomUUID();
    }

    public ClassificationJob(UUID jobUuid) {
        this.jobUuid = jobUuid;
    }

    public Long getId() {
        return id;
    }

    public UUID getJobUuid() {
        return jobUuid;
    }

    public JobState getStatus() {
        return status;
    }

    public void setStatus(JobState status) {
        this.status = status;
    }

    public String getIndustry() {
        return industry;
    }

    public void setIndustry(String industry) {
        this.industry = industry;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getMediaType() {
        return mediaType;
    }

    public void setMediaType(String mediaType) {
        this.mediaType = mediaType;
    }

    public Long getFileSizeBytes() {
        return fileSizeBytes;
    }

    public void setFileSizeBytes(Long fileSizeBytes) {
        this.fileSizeBytes = fileSizeBytes;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public UUID getBatchUuid() {
        return batchUuid;
    }

    public void setBatchUuid(UUID batchUuid) {
        this.batchUuid = batchUuid;
    }

    public Integer getBatchPosition() {
        return batchPosition;
    }

    public void setBatchPosition(Integer batchPosition) {
        this.batchPosition = batchPosition;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public Instant getLeaseExpiresAt() {
        return leaseExpiresAt;
    }

    public String getDocumentType() {
        return documentType;
    }

    public Double getConfidence() {
        return confidence;
    }

    public String getResultJson() {
        return resultJson;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public UUID getRetriedAs() {
        return retriedAs;
    }

    /**
     * Records a job that failed before it could be queued. Only meaningful before the first save.
     */
    public void failBeforeQueueing(ErrorCode errorCode, String errorMessage) {
        this.status = JobState.FAILURE;
        this.errorCode = errorCode;
        this.errorMessage = Strings.truncate(errorMessage, MAX_ERROR_MESSAGE_LENGTH);
        this.completedAt = Instant.now();
    }
}
