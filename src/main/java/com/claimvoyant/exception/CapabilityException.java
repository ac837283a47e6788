package com.claimvoyant.exception;

import com.claimvoyant.model.ServiceType;
import lombok.Getter;

/**
 * Failure of an external capability (storage, extraction, search, reasoning, secrets).
 */
@Getter
public class CapabilityException extends RuntimeException {

    private final ServiceType service;
    private final String operation;

    public CapabilityException(ServiceType service, String operation, String message) {
        super(service.getName() + " " + operation + " failed: " + message);
        this.service = service;
        this.operation = operation;
    }

    public CapabilityException(ServiceType service, String operation, String message, Throwable cause) {
        super(service.getName() + " " + operation + " failed: " + message, cause);
        this.service = service;
        this.operation = operation;
    }
}
