package com.claimvoyant.model.claim;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Policy terms resolved for the claim. When {@code found} is false only
 * {@code reason} is set; Decision still runs and reasons about the gap.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyData {

    @JsonProperty("found")
    boolean found;

    @JsonProperty("policy_id")
    String policyId;

    @JsonProperty("coverage_type")
    String coverageType;

    @JsonProperty("deductible")
    Double deductible;

    @JsonProperty("coverage_limit")
    Double coverageLimit;

    @JsonProperty("filing_deadline_days")
    Integer filingDeadlineDays;

    @JsonProperty("content")
    String content;

    @JsonProperty("reason")
    String reason;

    public static PolicyData notFound(String reason) {
        return PolicyData.builder().found(false).reason(reason).build();
    }
}
