package com.claimvoyant.model.claim;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category Intake assigns to an uploaded file.
 */
public enum FileType {
    PDF("pdf"),
    IMAGE("image"),
    UNKNOWN("unknown");

    private final String value;

    FileType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FileType fromValue(String value) {
        for (FileType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Maps a key extension to the capability that can read it.
     */
    public static FileType forExtension(String extension) {
        if (extension == null) {
            return UNKNOWN;
        }
        return switch (extension.toLowerCase()) {
            case "pdf" -> PDF;
            case "jpg", "jpeg", "png" -> IMAGE;
            default -> UNKNOWN;
        };
    }
}
