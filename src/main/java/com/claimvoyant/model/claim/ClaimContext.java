package com.claimvoyant.model.claim;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Accumulating state of one pipeline execution for one claim.
 *
 * <p>Each stage field is written once, by the stage that owns it. The
 * {@code with*} methods return a new context and refuse to overwrite a field a
 * previous stage already populated, so later stages can read earlier results
 * but never replace them.
 *
 * <p>Owned by the pipeline engine for the duration of a run; never shared
 * between concurrent executions.
 */
@Value
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
public class ClaimContext {

    String claimId;
    StorageLocation sourceLocation;
    ExtractedData extractedData;
    ClaimEntities entities;
    PolicyData policyData;
    DamageAssessment damageAssessment;
    Valuation valuation;
    DecisionData decisionData;

    /**
     * Initial context handed to the pipeline.
     *
     * @param claimId pre-assigned claim id, or null to let Intake generate one
     * @param sourceLocation uploaded document location
     */
    public static ClaimContext start(String claimId, StorageLocation sourceLocation) {
        return ClaimContext.builder()
                .claimId(claimId)
                .sourceLocation(sourceLocation)
                .build();
    }

    public boolean hasClaimId() {
        return claimId != null && !claimId.isBlank();
    }

    public ClaimContext withClaimId(String id) {
        requireUnset("claimId", hasClaimId() ? claimId : null);
        return toBuilder().claimId(id).build();
    }

    /**
     * Intake output: extracted content and the entities parsed from it.
     */
    public ClaimContext withIntake(ExtractedData extracted, ClaimEntities parsedEntities) {
        requireUnset("extractedData", extractedData);
        requireUnset("entities", entities);
        return toBuilder().extractedData(extracted).entities(parsedEntities).build();
    }

    public ClaimContext withPolicyData(PolicyData policy) {
        requireUnset("policyData", policyData);
        return toBuilder().policyData(policy).build();
    }

    public ClaimContext withDamageAssessment(DamageAssessment assessment) {
        requireUnset("damageAssessment", damageAssessment);
        return toBuilder().damageAssessment(assessment).build();
    }

    public ClaimContext withValuation(Valuation value) {
        requireUnset("valuation", valuation);
        return toBuilder().valuation(value).build();
    }

    public ClaimContext withDecisionData(DecisionData decision) {
        requireUnset("decisionData", decisionData);
        return toBuilder().decisionData(decision).build();
    }

    private static void requireUnset(String field, Object current) {
        if (current != null) {
            throw new IllegalStateException("Claim context field '" + field + "' is already set");
        }
    }
}
