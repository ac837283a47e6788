package com.claimvoyant.model.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome recorded for one stage attempt. NOT_FOUND is a normal result
 * (Policy Resolution found no match) and is kept distinct from ERROR.
 */
public enum AuditStatus {
    SUCCESS("success"),
    ERROR("error"),
    NOT_FOUND("not_found");

    private final String value;

    AuditStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AuditStatus fromValue(String value) {
        for (AuditStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown audit status: " + value);
    }
}
