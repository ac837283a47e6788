package com.claimvoyant.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class AwsProperties {

    @NotBlank
    private String region = "us-east-1";

    /**
     * Upper bound for one SDK call including its retries.
     */
    @NotNull
    private Duration apiCallTimeout = Duration.ofSeconds(30);

    /**
     * Upper bound for a single HTTP attempt.
     */
    @NotNull
    private Duration apiCallAttemptTimeout = Duration.ofSeconds(10);

    /**
     * Delay between two Textract job status polls.
     */
    @NotNull
    private Duration textractPollInterval = Duration.ofSeconds(2);

    /**
     * Give up on a Textract job after this long.
     */
    @NotNull
    private Duration textractMaxWait = Duration.ofMinutes(5);
}
