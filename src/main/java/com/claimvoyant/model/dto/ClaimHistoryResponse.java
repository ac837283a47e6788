package com.claimvoyant.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimHistoryResponse {

    @JsonProperty("claim_id")
    private String claimId;

    /**
     * Oldest first.
     */
    private List<ClaimRecordView> versions;
}
