package com.claimvoyant.model.claim;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Valuation {

    @JsonProperty("vehicle_value")
    double vehicleValue;

    @JsonProperty("vehicle_info")
    String vehicleInfo;

    @JsonProperty("market_source")
    String marketSource;

    @JsonProperty("confidence")
    double confidence;
}
