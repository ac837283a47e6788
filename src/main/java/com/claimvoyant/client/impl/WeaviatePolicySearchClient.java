package com.claimvoyant.client.impl;

import com.claimvoyant.client.PolicySearchClient;
import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.CallContext;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.util.ExternalCallLogger;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Policy lookup through Weaviate's GraphQL {@code hybrid} operator.
 *
 * Equivalent query:
 * <pre>
 * { Get { PolicyDocuments(hybrid: {query: "AUTO-001"}, limit: 1) {
 *     policy_id content coverage_type deductible coverage_limit filing_deadline_days } } }
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeaviatePolicySearchClient implements PolicySearchClient {

    private static final String POLICY_FIELDS =
            "policy_id content coverage_type deductible coverage_limit filing_deadline_days";

    private final WeaviateConnectionFactory connectionFactory;
    private final AppProperties props;
    private final ObjectMapper objectMapper;

    @Override
    public List<Map<String, Object>> hybridSearch(String query, int limit) {
        String collection = props.getWeaviate().getPolicyCollection();
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.WEAVIATE, "hybridSearch", log);
        callCtx.logRequest("Searching policies",
                "Collection", collection,
                "Query", query,
                "Limit", limit);

        try {
            String graphql = String.format("{ Get { %s(hybrid: {query: %s}, limit: %d) { %s } } }",
                    collection, objectMapper.writeValueAsString(query), limit, POLICY_FIELDS);

            JsonNode response = connectionFactory.getClient().post()
                    .uri("/v1/graphql")
                    .bodyValue(Map.of("query", graphql))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(props.getWeaviate().getTimeout())
                    .block();

            if (response == null) {
                throw new CapabilityException(ServiceType.WEAVIATE, "hybridSearch", "empty response");
            }
            JsonNode errors = response.path("errors");
            if (errors.isArray() && !errors.isEmpty()) {
                throw new CapabilityException(ServiceType.WEAVIATE, "hybridSearch",
                        errors.get(0).path("message").asText("GraphQL error"));
            }

            List<Map<String, Object>> results = new ArrayList<>();
            for (JsonNode hit : response.path("data").path("Get").path(collection)) {
                results.add(objectMapper.convertValue(hit, new TypeReference<Map<String, Object>>() {
                }));
            }

            callCtx.logResponse("Search complete", "Hits", results.size());
            return results;

        } catch (CapabilityException e) {
            callCtx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            callCtx.logError(e.getMessage(), e);
            throw new CapabilityException(ServiceType.WEAVIATE, "hybridSearch", e.getMessage(), e);
        }
    }
}
