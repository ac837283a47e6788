package com.claimvoyant.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Status of one claim. Decision fields are present only for DECIDED claims,
 * {@code failed_stage} and {@code error} only for FAILED ones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClaimStatusResponse {

    @JsonProperty("claim_id")
    private String claimId;

    @JsonProperty("processing_status")
    private ClaimProcessingStatus processingStatus;

    /**
     * Record status (the decision value) when decided, otherwise "processing" or "failed".
     */
    private String status;

    private Long version;

    private Instant timestamp;

    private String decision;

    private String reasoning;

    private Double confidence;

    @JsonProperty("estimated_payout")
    private Double estimatedPayout;

    private JsonNode entities;

    @JsonProperty("failed_stage")
    private String failedStage;

    private String error;

    private String message;
}
