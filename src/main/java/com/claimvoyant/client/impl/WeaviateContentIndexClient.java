package com.claimvoyant.client.impl;

import com.claimvoyant.client.ContentIndexClient;
import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.CallContext;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.util.ExternalCallLogger;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inserts claim artifacts into the Weaviate artifact collection via {@code POST /v1/objects}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeaviateContentIndexClient implements ContentIndexClient {

    private final WeaviateConnectionFactory connectionFactory;
    private final AppProperties props;

    @Override
    public void index(ClaimArtifact artifact) {
        String collection = props.getWeaviate().getArtifactCollection();
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.WEAVIATE, "insertObject", log);
        callCtx.logRequest("Indexing claim artifact",
                "Collection", collection,
                "Claim", artifact.claimId(),
                "Text Length", artifact.extractedText() != null ? artifact.extractedText().length() : 0);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("claim_id", artifact.claimId());
        properties.put("s3_bucket", artifact.bucket());
        properties.put("s3_key", artifact.key());
        properties.put("file_type", artifact.fileType());
        properties.put("extracted_text", artifact.extractedText());
        properties.put("entities", artifact.entitiesJson());
        properties.put("metadata", artifact.metadataJson());

        try {
            JsonNode response = connectionFactory.getClient().post()
                    .uri("/v1/objects")
                    .bodyValue(Map.of("class", collection, "properties", properties))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(props.getWeaviate().getTimeout())
                    .block();

            callCtx.logResponse("Artifact indexed",
                    "Object", response != null ? response.path("id").asText("?") : "?");
        } catch (CapabilityException e) {
            callCtx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            callCtx.logError(e.getMessage(), e);
            throw new CapabilityException(ServiceType.WEAVIATE, "insertObject", e.getMessage(), e);
        }
    }
}
