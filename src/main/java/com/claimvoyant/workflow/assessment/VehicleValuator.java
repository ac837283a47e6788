package com.claimvoyant.workflow.assessment;

import com.claimvoyant.model.claim.ClaimEntities;
import com.claimvoyant.model.claim.Valuation;

public interface VehicleValuator {

    Valuation value(ClaimEntities entities);
}
