package com.claimvoyant.client;

/**
 * Searchable index of claim artifacts.
 */
public interface ContentIndexClient {

    void index(ClaimArtifact artifact);

    /**
     * One indexed claim document.
     *
     * @param entitiesJson parsed entities as JSON
     * @param metadataJson extraction result as JSON
     */
    record ClaimArtifact(
            String claimId,
            String bucket,
            String key,
            String fileType,
            String extractedText,
            String entitiesJson,
            String metadataJson) {
    }
}
