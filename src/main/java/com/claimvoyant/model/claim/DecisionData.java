package com.claimvoyant.model.claim;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structured adjudication result. Field names on the wire match the JSON
 * schema the reasoning engine is asked to produce.
 */
@Value
@Builder
@Jacksonized
public class DecisionData {

    @JsonProperty("decision")
    ClaimDecision decision;

    @JsonProperty("reasoning")
    String reasoning;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("estimated_payout")
    double estimatedPayout;

    @JsonProperty("deductible_applies")
    boolean deductibleApplies;

    @JsonProperty("required_actions")
    @Builder.Default
    List<String> requiredActions = List.of();

    @JsonProperty("risk_factors")
    @Builder.Default
    List<String> riskFactors = List.of();

    /**
     * Fallback used when the reasoning call fails or its answer cannot be parsed.
     */
    public static DecisionData fallback(String diagnostic) {
        String reasoning = diagnostic == null || diagnostic.isBlank()
                ? "Failed to process claim: no diagnostic available"
                : diagnostic;
        return DecisionData.builder()
                .decision(ClaimDecision.ERROR)
                .reasoning(reasoning)
                .confidence(0.0)
                .estimatedPayout(0.0)
                .deductibleApplies(false)
                .build();
    }
}
