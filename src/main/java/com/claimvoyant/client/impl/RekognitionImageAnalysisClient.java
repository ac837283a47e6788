package com.claimvoyant.client.impl;

import com.claimvoyant.client.ImageAnalysisClient;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.CallContext;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.model.claim.DetectedLabel;
import com.claimvoyant.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.rekognition.RekognitionClient;
import software.amazon.awssdk.services.rekognition.model.DetectLabelsRequest;
import software.amazon.awssdk.services.rekognition.model.DetectTextRequest;
import software.amazon.awssdk.services.rekognition.model.Image;
import software.amazon.awssdk.services.rekognition.model.S3Object;
import software.amazon.awssdk.services.rekognition.model.TextTypes;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class RekognitionImageAnalysisClient implements ImageAnalysisClient {

    private final RekognitionClient rekognitionClient;

    @Override
    public List<DetectedLabel> detectLabels(String bucket, String key, int maxLabels, float minConfidence) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.REKOGNITION, "detectLabels", log);
        callCtx.logRequest("Detecting labels",
                "Image", "s3://" + bucket + "/" + key,
                "Max Labels", maxLabels,
                "Min Confidence", minConfidence);
        try {
            List<DetectedLabel> labels = rekognitionClient.detectLabels(DetectLabelsRequest.builder()
                            .image(image(bucket, key))
                            .maxLabels(maxLabels)
                            .minConfidence(minConfidence)
                            .build())
                    .labels()
                    .stream()
                    .map(label -> new DetectedLabel(label.name(),
                            label.confidence() != null ? label.confidence() : 0.0))
                    .toList();
            callCtx.logResponse("Labels detected", "Count", labels.size(), "Labels", labels);
            return labels;
        } catch (SdkException e) {
            callCtx.logError(e.getMessage(), e);
            throw new CapabilityException(ServiceType.REKOGNITION, "detectLabels", e.getMessage(), e);
        }
    }

    @Override
    public String detectText(String bucket, String key) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.REKOGNITION, "detectText", log);
        callCtx.logRequest("Detecting text", "Image", "s3://" + bucket + "/" + key);
        try {
            String text = rekognitionClient.detectText(DetectTextRequest.builder()
                            .image(image(bucket, key))
                            .build())
                    .textDetections()
                    .stream()
                    .filter(detection -> detection.type() == TextTypes.LINE)
                    .map(detection -> detection.detectedText())
                    .collect(Collectors.joining(" "));
            callCtx.logResponse("Text detected", "Text", ExternalCallLogger.truncate(text, 200));
            return text;
        } catch (SdkException e) {
            callCtx.logError(e.getMessage(), e);
            throw new CapabilityException(ServiceType.REKOGNITION, "detectText", e.getMessage(), e);
        }
    }

    private static Image image(String bucket, String key) {
        return Image.builder()
                .s3Object(S3Object.builder().bucket(bucket).name(key).build())
                .build();
    }
}
