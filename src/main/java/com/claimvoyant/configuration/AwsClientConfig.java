package com.claimvoyant.configuration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.rekognition.RekognitionClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * AWS SDK clients, built once at start-up and injected into the capability
 * adapters. Every client carries the configured call and attempt timeouts so
 * no stage can block indefinitely on AWS.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AwsClientConfig {

    private final AppProperties props;

    @Bean
    public S3Client s3Client() {
        return S3Client.builder()
                .region(region())
                .overrideConfiguration(overrides())
                .build();
    }

    @Bean
    public TextractClient textractClient() {
        return TextractClient.builder()
                .region(region())
                .overrideConfiguration(overrides())
                .build();
    }

    @Bean
    public RekognitionClient rekognitionClient() {
        return RekognitionClient.builder()
                .region(region())
                .overrideConfiguration(overrides())
                .build();
    }

    @Bean
    public SecretsManagerClient secretsManagerClient() {
        return SecretsManagerClient.builder()
                .region(region())
                .overrideConfiguration(overrides())
                .build();
    }

    private Region region() {
        return Region.of(props.getAws().getRegion());
    }

    private ClientOverrideConfiguration overrides() {
        AwsProperties aws = props.getAws();
        log.debug("AWS client timeouts: call={}, attempt={}", aws.getApiCallTimeout(), aws.getApiCallAttemptTimeout());
        return ClientOverrideConfiguration.builder()
                .apiCallTimeout(aws.getApiCallTimeout())
                .apiCallAttemptTimeout(aws.getApiCallAttemptTimeout())
                .build();
    }
}
