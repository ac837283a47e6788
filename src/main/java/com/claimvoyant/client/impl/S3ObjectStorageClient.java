package com.claimvoyant.client.impl;

import com.claimvoyant.client.ObjectStorageClient;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.CallContext;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

@Slf4j
@Component
@RequiredArgsConstructor
public class S3ObjectStorageClient implements ObjectStorageClient {

    private final S3Client s3Client;

    @Override
    public void put(String bucket, String key, byte[] content, String contentType) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.S3, "putObject", log);
        callCtx.logRequest("Storing object",
                "Bucket", bucket,
                "Key", key,
                "Size", content.length + " bytes",
                "Content-Type", contentType);
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentType)
                            .build(),
                    RequestBody.fromBytes(content));
            callCtx.logResponse("Object stored", "Location", "s3://" + bucket + "/" + key);
        } catch (SdkException e) {
            callCtx.logError(e.getMessage(), e);
            throw new CapabilityException(ServiceType.S3, "putObject", e.getMessage(), e);
        }
    }

    @Override
    public byte[] get(String bucket, String key) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.S3, "getObject", log);
        callCtx.logRequest("Reading object", "Bucket", bucket, "Key", key);
        try {
            byte[] bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .build())
                    .asByteArray();
            callCtx.logResponse("Object read", "Size", bytes.length + " bytes");
            return bytes;
        } catch (SdkException e) {
            callCtx.logError(e.getMessage(), e);
            throw new CapabilityException(ServiceType.S3, "getObject", e.getMessage(), e);
        }
    }
}
