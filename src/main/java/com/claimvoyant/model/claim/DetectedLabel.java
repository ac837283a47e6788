package com.claimvoyant.model.claim;

/**
 * Image label reported by image analysis.
 *
 * @param name label name, e.g. "Car"
 * @param confidence detector confidence, 0-100
 */
public record DetectedLabel(String name, double confidence) {
}
