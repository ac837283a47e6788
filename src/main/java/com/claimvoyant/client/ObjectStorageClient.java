package com.claimvoyant.client;

/**
 * Blob storage for uploaded claim documents and decision reports.
 */
public interface ObjectStorageClient {

    void put(String bucket, String key, byte[] content, String contentType);

    byte[] get(String bucket, String key);
}
