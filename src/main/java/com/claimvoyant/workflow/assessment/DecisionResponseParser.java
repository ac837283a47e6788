package com.claimvoyant.workflow.assessment;

import com.claimvoyant.model.claim.ClaimDecision;
import com.claimvoyant.model.claim.DecisionData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the reasoning engine's answer into a {@link DecisionData}.
 *
 * <p>Surrounding Markdown code fences are tolerated. The payload itself must
 * match the schema exactly: an object with {@code decision} in
 * APPROVED/DENIED/PENDING, non-blank {@code reasoning}, {@code confidence} in
 * [0, 1], {@code estimated_payout} >= 0 and boolean {@code deductible_applies}.
 * {@code required_actions} and {@code risk_factors} are optional string arrays.
 * Nothing may follow the object.
 * Anything else yields the ERROR fallback decision with a diagnostic reasoning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecisionResponseParser {

    private final ObjectMapper objectMapper;

    public DecisionData parse(String response) {
        if (response == null || response.isBlank()) {
            return DecisionData.fallback("Failed to process claim: empty response from reasoning engine");
        }
        try {
            // Text after the object is a violation, not something to skip
            JsonNode root = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(stripCodeFences(response));
            return toDecision(root);
        } catch (JsonProcessingException e) {
            log.warn("Reasoning response is not JSON: {}", e.getOriginalMessage());
            return DecisionData.fallback("Failed to process claim: response is not valid JSON (" + e.getOriginalMessage() + ")");
        } catch (IllegalArgumentException e) {
            log.warn("Reasoning response violates decision schema: {}", e.getMessage());
            return DecisionData.fallback("Failed to process claim: " + e.getMessage());
        }
    }

    static String stripCodeFences(String response) {
        String trimmed = response.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        String body = firstNewline >= 0 ? trimmed.substring(firstNewline + 1) : "";
        if (body.endsWith("```")) {
            body = body.substring(0, body.length() - 3);
        }
        return body.trim();
    }

    private DecisionData toDecision(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("response is not a JSON object");
        }

        JsonNode decisionNode = root.path("decision");
        if (!decisionNode.isTextual()) {
            throw new IllegalArgumentException("'decision' is missing");
        }
        ClaimDecision decision;
        try {
            decision = ClaimDecision.valueOf(decisionNode.asText());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown decision '" + decisionNode.asText() + "'");
        }
        if (!decision.isReasoned()) {
            throw new IllegalArgumentException("decision '" + decision + "' is not allowed");
        }

        JsonNode reasoning = root.path("reasoning");
        if (!reasoning.isTextual() || reasoning.asText().isBlank()) {
            throw new IllegalArgumentException("'reasoning' is missing or blank");
        }

        double confidence = requireNumber(root, "confidence");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("'confidence' " + confidence + " is outside [0, 1]");
        }

        double payout = requireNumber(root, "estimated_payout");
        if (payout < 0.0) {
            throw new IllegalArgumentException("'estimated_payout' is negative");
        }

        JsonNode deductible = root.path("deductible_applies");
        if (!deductible.isBoolean()) {
            throw new IllegalArgumentException("'deductible_applies' must be a boolean");
        }

        return DecisionData.builder()
                .decision(decision)
                .reasoning(reasoning.asText())
                .confidence(confidence)
                .estimatedPayout(payout)
                .deductibleApplies(deductible.asBoolean())
                .requiredActions(stringList(root, "required_actions"))
                .riskFactors(stringList(root, "risk_factors"))
                .build();
    }

    private static double requireNumber(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (!node.isNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be a number");
        }
        return node.asDouble();
    }

    private static List<String> stringList(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new IllegalArgumentException("'" + field + "' must contain only strings");
            }
            values.add(item.asText());
        }
        return List.copyOf(values);
    }
}
