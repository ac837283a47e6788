package com.claimvoyant.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class WeaviateProperties {

    /**
     * Secret holding {@code url} and {@code api_key}. Used when {@link #url} is empty.
     */
    @NotBlank
    private String secretName = "claimvoyant/weaviate";

    /**
     * Direct cluster URL; overrides the secret when set.
     */
    private String url;

    private String apiKey;

    @NotBlank
    private String policyCollection = "PolicyDocuments";

    @NotBlank
    private String artifactCollection = "ClaimArtifacts";

    @NotNull
    private Duration timeout = Duration.ofSeconds(15);
}
