package com.claimvoyant.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Latest version of one claim, as listed by {@code GET /api/v1/claims}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimSummary {

    @JsonProperty("claim_id")
    private String claimId;

    private long version;

    private String status;

    private Instant timestamp;

    private String decision;

    private Double confidence;
}
