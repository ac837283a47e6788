package com.claimvoyant.model.claim;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class DamageAssessment {

    @JsonProperty("damage_detected")
    boolean damageDetected;

    @JsonProperty("severity")
    DamageSeverity severity;

    @JsonProperty("estimated_repair_cost")
    double estimatedRepairCost;

    @JsonProperty("damage_locations")
    @Builder.Default
    List<String> damageLocations = List.of();

    @JsonProperty("confidence")
    double confidence;
}
