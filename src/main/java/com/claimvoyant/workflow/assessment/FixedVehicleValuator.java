package com.claimvoyant.workflow.assessment;

import com.claimvoyant.model.claim.ClaimEntities;
import com.claimvoyant.model.claim.Valuation;
import org.springframework.stereotype.Component;

/**
 * Returns a fixed market value for every vehicle.
 */
@Component
public class FixedVehicleValuator implements VehicleValuator {

    static final double VEHICLE_VALUE = 25000.0;
    static final String MARKET_SOURCE = "Mock Data (KBB/NADA in production)";

    @Override
    public Valuation value(ClaimEntities entities) {
        String vehicleInfo = entities != null && entities.getVehicleInfo() != null
                ? entities.getVehicleInfo()
                : "Unknown";
        return Valuation.builder()
                .vehicleValue(VEHICLE_VALUE)
                .vehicleInfo(vehicleInfo)
                .marketSource(MARKET_SOURCE)
                .confidence(0.8)
                .build();
    }
}
