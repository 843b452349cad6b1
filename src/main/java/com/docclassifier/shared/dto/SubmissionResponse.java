package com.docclassifier.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Acknowledgement of an accepted asynchronous job or batch.
 */
public class SubmissionResponse {

    private final UUID id;
    private final String status;
    private final String statusUrl;

    public SubmissionResponse(UUID id, String status, String statusUrl) {
        this.id = id;
        this.status = status;
        this.statusUrl = statusUrl;
    }

    @JsonProperty("id")
    public UUID getId() {
        return id;
    }

    @JsonProperty("status")
    public String getStatus() {
        return status;
    }

    @JsonProperty("status_url")
    public String getStatusUrl() {
        return statusUrl;
    }
}
