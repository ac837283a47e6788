package com.claimvoyant.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PipelineProperties {

    /**
     * Policy looked up when Intake found no policy number in the document.
     */
    @NotBlank
    private String defaultPolicyNumber = "AUTO-001";

    @Min(1)
    private int maxLabels = 10;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private float minLabelConfidence = 70.0f;

    /**
     * Extracted text longer than this is cut before it is sent to the content index.
     */
    @Min(1)
    private int indexTextLimit = 50_000;

    @Min(1)
    private int decisionMaxTokens = 2048;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double decisionTemperature = 0.3;

    /**
     * Attempts to append a claim record before giving up on version contention.
     */
    @Min(1)
    private int versionMaxAttempts = 10;
}
