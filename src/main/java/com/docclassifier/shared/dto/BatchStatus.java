package com.docclassifier.shared.dto;

import com.docclassifier.shared.model.BatchState;
import com.docclassifier.shared.model.JobState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Derived status of a batch, computed from member jobs read in the same call.
 */
public class BatchStatus {

    private final UUID batchId;
    private final BatchState state;
    private final String industry;
    private final Instant createdAt;
    private final Map<JobState, Integer> counts;
    private final List<JobView> jobs;

    public BatchStatus(UUID batchId, BatchState state, String industry, Instant createdAt, List<JobView> jobs) {
        this.batchId = batchId;
        this.state = state;
        this.industry = industry;
        this.createdAt = createdAt;
        this.jobs = List.copyOf(jobs);
        Map<JobState, Integer> tally = new EnumMap<>(JobState.class);
        for (JobState s : JobState.values()) {
            tally.put(s, 0);
        }
        for (JobView job : jobs) {
            tally.merge(job.getStatus(), 1, Integer::sum);
        }
        this.counts = Collections.unmodifiableMap(tally);
    }

    @JsonProperty("batch_id")
    public UUID getBatchId() {
        return batchId;
    }

    @JsonProperty("state")
    public BatchState getState() {
        return state;
    }

    @JsonProperty("industry")
    public String getIndustry() {
        return industry;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("total")
    public int getTotal() {
        return jobs.size();
    }

    @JsonProperty("counts")
    public Map<JobState, Integer> getCounts() {
        return counts;
    }

    @JsonProperty("jobs")
    public List<JobView> getJobs() {
        return jobs;
    }
}
