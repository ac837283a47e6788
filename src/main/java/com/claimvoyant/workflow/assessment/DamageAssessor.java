package com.claimvoyant.workflow.assessment;

import com.claimvoyant.model.claim.DamageAssessment;
import com.claimvoyant.model.claim.ExtractedData;

public interface DamageAssessor {

    DamageAssessment assess(ExtractedData extractedData);
}
