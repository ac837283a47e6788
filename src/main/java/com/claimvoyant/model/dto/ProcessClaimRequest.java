package com.claimvoyant.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Starts the pipeline for a document that is already in object storage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessClaimRequest {
    private String bucket;
    private String key;

    /**
     * Optional; generated when absent.
     */
    @JsonProperty("claim_id")
    private String claimId;
}
