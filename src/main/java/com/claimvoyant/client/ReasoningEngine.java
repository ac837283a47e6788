package com.claimvoyant.client;

/**
 * Large language model used by the Decision stage.
 */
public interface ReasoningEngine {

    /**
     * Sends a single prompt and returns the raw model text.
     *
     * @throws com.claimvoyant.exception.CapabilityException when the call fails or times out
     */
    String invoke(String prompt, int maxTokens, double temperature);
}
