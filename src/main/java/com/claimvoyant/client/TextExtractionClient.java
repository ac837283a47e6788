package com.claimvoyant.client;

/**
 * Text extraction from documents already held in object storage.
 *
 * Implementations block until the extraction job finishes or the configured
 * maximum wait expires, and throw {@link com.claimvoyant.exception.CapabilityException}
 * on a failed job or timeout.
 */
public interface TextExtractionClient {

    ExtractedText extractText(String bucket, String key);

    /**
     * @param text detected lines joined with newlines
     * @param jobId id of the extraction job
     */
    record ExtractedText(String text, String jobId) {
    }
}
