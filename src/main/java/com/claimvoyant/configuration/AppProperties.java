package com.claimvoyant.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /**
     * Prefix of every bucket the service uses: {@code <prefix>-raw-claims} for uploads and
     * {@code <prefix>-reports} for decision reports.
     */
    @NotBlank(message = "Bucket prefix is required")
    private String bucketPrefix = "claimvoyant";

    /**
     * Reported by the root health endpoint.
     */
    @NotBlank
    private String apiVersion = "1.0.0";

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AwsProperties aws = new AwsProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private WeaviateProperties weaviate = new WeaviateProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PipelineProperties pipeline = new PipelineProperties();

    public String getRawClaimsBucket() {
        return bucketPrefix + "-raw-claims";
    }

    public String getReportsBucket() {
        return bucketPrefix + "-reports";
    }
}
