package com.claimvoyant.model.claim;

/**
 * Object-storage address of an uploaded claim document.
 *
 * @param bucket bucket name
 * @param key object key, the extension decides how Intake routes the file
 */
public record StorageLocation(String bucket, String key) {

    public boolean isComplete() {
        return bucket != null && !bucket.isBlank() && key != null && !key.isBlank();
    }

    /**
     * Lower-cased extension of the key, or an empty string when the key has none.
     */
    public String extension() {
        if (key == null) {
            return "";
        }
        int dot = key.lastIndexOf('.');
        int slash = key.lastIndexOf('/');
        if (dot < 0 || dot < slash || dot == key.length() - 1) {
            return "";
        }
        return key.substring(dot + 1).toLowerCase();
    }

    @Override
    public String toString() {
        return "s3://" + bucket + "/" + key;
    }
}
