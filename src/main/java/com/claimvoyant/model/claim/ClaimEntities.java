package com.claimvoyant.model.claim;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Structured fields parsed from the claim text. Every field is optional;
 * a field that was not found stays {@code null}.
 */
@Value
@Builder
@Jacksonized
public class ClaimEntities {

    @JsonProperty("policy_number")
    String policyNumber;

    @JsonProperty("claimant_name")
    String claimantName;

    @JsonProperty("incident_date")
    String incidentDate;

    @JsonProperty("incident_location")
    String incidentLocation;

    @JsonProperty("vehicle_info")
    String vehicleInfo;

    public static ClaimEntities empty() {
        return ClaimEntities.builder().build();
    }
}
