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
public class AuditLogResponse {

    @JsonProperty("claim_id")
    private String claimId;

    /**
     * Chronological.
     */
    @JsonProperty("audit_logs")
    private List<AuditEntryView> auditLogs;
}
