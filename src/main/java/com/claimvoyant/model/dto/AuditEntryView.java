package com.claimvoyant.model.dto;

import com.claimvoyant.model.audit.AuditStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryView {

    @JsonProperty("log_id")
    private String logId;

    private String agent;

    private String action;

    private AuditStatus status;

    private JsonNode details;

    private Instant timestamp;
}
