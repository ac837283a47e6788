package com.claimvoyant.model;

/**
 * External capabilities the pipeline talks to.
 *
 * Used by ExternalCallLogger to tag request/response lines and by
 * CapabilityException to say which collaborator failed.
 *
 * @see com.claimvoyant.util.ExternalCallLogger
 */
public enum ServiceType {
    S3("🪣", "S3"),
    TEXTRACT("📄", "Textract"),
    REKOGNITION("🖼", "Rekognition"),
    WEAVIATE("🟢", "Weaviate"),
    GEMINI("🔴", "Gemini"),
    SECRETS_MANAGER("🔐", "SecretsManager"),
    DATABASE("🟠", "Database");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
