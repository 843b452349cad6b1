package com.docclassifier.shared.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A group of classification jobs submitted together. Members are the jobs carrying this
 * batch's uuid; the batch state is derived from them and not stored here.
 */
@Entity
@Table(name = "batch_jobs", indexes = {
    @Index(name = "idx_batch_uuid", columnList = "batch_uuid")
})
public class BatchJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_uuid", nullable = false, unique = true, updatable = false)
    @NotNull
    private UUID batchUuid;

    @Column(name = "industry", length = 50)
    private String industry;

    @Column(name = "member_count", nullable = false)
    private int memberCount;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public BatchJob() {
        this.batchUuid = UUID.randomUUID();
    }

    public BatchJob(UUID batchUuid) {
        this.batchUuid = batchUuid;
    }

    public Long getId() {
        return id;
    }

    public UUID getBatchUuid() {
        return batchUuid;
    }

    public String getIndustry() {
        return industry;
    }

    public void setIndustry(String industry) {
        this.industry = industry;
    }

    public int getMemberCount() {
        return memberCount;
    }

    public void setMemberCount(int memberCount) {
        this.memberCount = memberCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
