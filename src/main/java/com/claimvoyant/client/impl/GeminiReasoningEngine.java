package com.claimvoyant.client.impl;

import com.claimvoyant.client.ReasoningEngine;
import com.claimvoyant.config.GeminiConfig;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.CallContext;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.util.ExternalCallLogger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiReasoningEngine implements ReasoningEngine {

    private final GeminiConfig geminiConfig;
    private final ObjectMapper objectMapper;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        init(WebClient.builder());
    }

    void init(WebClient.Builder builder) {
        // Key sent as a header, never as a query parameter
        this.geminiWebClient = builder
                .baseUrl(geminiConfig.getBaseUrl())
                .defaultHeader("x-goog-api-key", geminiConfig.getApiKey() != null ? geminiConfig.getApiKey() : "")
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    private String getApiUrl(String model, String action) {
        return String.format("/%s/models/%s:%s", geminiConfig.getApiVersion(), model, action);
    }

    /**
     * Exponential backoff on the configured retryable status codes.
     */
    private Retry buildRetrySpec() {
        GeminiConfig.RetryConfig retry = geminiConfig.getRetry();
        return Retry.backoff(
                        retry.getMaxAttempts(),
                        Duration.ofSeconds(retry.getInitialBackoffSeconds()))
                .maxBackoff(Duration.ofSeconds(retry.getMaxBackoffSeconds()))
                .filter(this::isRetryable);
    }

    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        List<Integer> codes = geminiConfig.getRetry().getRetryableStatusCodes();
        if (codes == null || codes.isEmpty()) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return codes.contains(webEx.getStatusCode().value());
    }

    @Override
    public String invoke(String prompt, int maxTokens, double temperature) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);

        String model = geminiConfig.getChatModel();
        callCtx.logRequest("Generating text",
                "Model", model,
                "Max Tokens", maxTokens,
                "Temperature", temperature,
                "Prompt Length", prompt.length() + " chars",
                "Prompt", ExternalCallLogger.truncate(prompt, 500));

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "temperature", temperature,
                        "maxOutputTokens", maxTokens));

        try {
            String json = geminiWebClient.post().uri(getApiUrl(model, "generateContent")).bodyValue(body)
                    .retrieve().bodyToMono(String.class)
                    .retryWhen(buildRetrySpec())
                    .timeout(geminiConfig.getTimeout())
                    .block();

            JsonNode root = objectMapper.readTree(json);
            JsonNode textNode = root.path("candidates").path(0)
                    .path("content").path("parts").path(0)
                    .path("text");
            if (textNode.isMissingNode() || textNode.isNull()) {
                throw new CapabilityException(ServiceType.GEMINI, "generateContent",
                        "response has no candidate text");
            }
            String response = textNode.asText();

            JsonNode usage = root.path("usageMetadata");
            callCtx.logResponse("Text generated successfully",
                    "Tokens", String.format("%d in + %d out",
                            usage.path("promptTokenCount").asInt(0),
                            usage.path("candidatesTokenCount").asInt(0)),
                    "Response Length", response.length() + " chars",
                    "Response", ExternalCallLogger.truncate(response, 500));

            return response;

        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            throw new CapabilityException(ServiceType.GEMINI, "generateContent", e.getStatusCode().toString(), e);
        } catch (CapabilityException e) {
            callCtx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            callCtx.logError("Unexpected error", e);
            throw new CapabilityException(ServiceType.GEMINI, "generateContent", String.valueOf(e.getMessage()), e);
        }
    }
}
