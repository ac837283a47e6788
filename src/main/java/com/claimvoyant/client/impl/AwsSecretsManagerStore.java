package com.claimvoyant.client.impl;

import com.claimvoyant.client.SecretStore;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.CallContext;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.util.ExternalCallLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class AwsSecretsManagerStore implements SecretStore {

    private final SecretsManagerClient secretsManagerClient;
    private final ObjectMapper objectMapper;

    @Override
    public Map<String, String> getSecret(String name) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.SECRETS_MANAGER, "getSecretValue", log);
        callCtx.logRequest("Reading secret", "Secret", name);
        try {
            String secretString = secretsManagerClient.getSecretValue(GetSecretValueRequest.builder()
                            .secretId(name)
                            .build())
                    .secretString();
            if (secretString == null) {
                throw new CapabilityException(ServiceType.SECRETS_MANAGER, "getSecretValue",
                        "secret " + name + " has no string value");
            }

            Map<String, Object> raw = objectMapper.readValue(secretString, new TypeReference<>() {
            });
            Map<String, String> values = new LinkedHashMap<>();
            raw.forEach((k, v) -> values.put(k, v != null ? v.toString() : null));

            // Never log secret values
            callCtx.logResponse("Secret read", "Keys", values.keySet());
            return values;
        } catch (SdkException e) {
            callCtx.logError(e.getMessage(), e);
            throw new CapabilityException(ServiceType.SECRETS_MANAGER, "getSecretValue", e.getMessage(), e);
        } catch (JsonProcessingException e) {
            callCtx.logError("Secret is not a JSON object", e);
            throw new CapabilityException(ServiceType.SECRETS_MANAGER, "getSecretValue",
                    "secret " + name + " is not a JSON object", e);
        }
    }
}
