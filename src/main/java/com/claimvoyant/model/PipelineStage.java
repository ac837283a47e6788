package com.claimvoyant.model;

/**
 * The five stages of the claim pipeline, in execution order.
 *
 * <p>{@code agentName} and {@code action} are the values written to the audit
 * log; {@code agentName} is also the suffix of the audit {@code log_id}.
 */
public enum PipelineStage {
    INTAKE("intake", "extract_data"),
    POLICY("policy", "query_policy"),
    DAMAGE("damage", "assess_damage"),
    VALUATION("valuation", "get_valuation"),
    DECISION("decision", "make_decision");

    private final String agentName;
    private final String action;

    PipelineStage(String agentName, String action) {
        this.agentName = agentName;
        this.action = action;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getAction() {
        return action;
    }
}
