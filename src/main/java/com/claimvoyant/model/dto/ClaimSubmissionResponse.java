package com.claimvoyant.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Returned with HTTP 202 when a claim was accepted for processing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClaimSubmissionResponse {

    @JsonProperty("claim_id")
    private String claimId;

    private String status;

    private String bucket;

    private String key;

    private List<UploadedFile> files;

    private String message;

    public static ClaimSubmissionResponse processing(String claimId, String message) {
        return ClaimSubmissionResponse.builder()
                .claimId(claimId)
                .status("processing")
                .message(message)
                .build();
    }
}
