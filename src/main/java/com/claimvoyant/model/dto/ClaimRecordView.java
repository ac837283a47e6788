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
 * One committed claim record version with its JSON columns expanded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClaimRecordView {

    @JsonProperty("claim_id")
    private String claimId;

    private long version;

    private String status;

    private Instant timestamp;

    @JsonProperty("decision_data")
    private JsonNode decisionData;

    @JsonProperty("policy_data")
    private JsonNode policyData;

    @JsonProperty("extracted_data")
    private JsonNode extractedData;

    private JsonNode entities;

    @JsonProperty("damage_assessment")
    private JsonNode damageAssessment;

    private JsonNode valuation;
}
