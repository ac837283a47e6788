package com.claimvoyant.model.claim;

public enum DamageSeverity {
    NONE,
    MINOR,
    MODERATE,
    SEVERE
}
