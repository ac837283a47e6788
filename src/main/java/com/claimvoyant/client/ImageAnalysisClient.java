package com.claimvoyant.client;

import com.claimvoyant.model.claim.DetectedLabel;

import java.util.List;

/**
 * Label and text detection on images held in object storage.
 */
public interface ImageAnalysisClient {

    List<DetectedLabel> detectLabels(String bucket, String key, int maxLabels, float minConfidence);

    /**
     * Text lines found in the image, joined with single spaces. Empty when none.
     */
    String detectText(String bucket, String key);
}
