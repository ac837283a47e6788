package com.claimvoyant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the Google Gemini reasoning engine.
 *
 * <p>Properties are loaded from the {@code app.gemini} namespace in application.yml:
 * <pre>
 * app:
 *   gemini:
 *     api-key: ${GEMINI_KEY}
 *     chat-model: gemini-2.0-flash
 *     base-url: https://generativelanguage.googleapis.com
 *     api-version: v1beta
 *     timeout: 60s
 *     retry:
 *       max-attempts: 3
 *       initial-backoff-seconds: 2
 * </pre>
 *
 * <p>Sampling parameters (max tokens, temperature) are chosen per call by the caller.
 */
@ConfigurationProperties(prefix = "app.gemini")
@Data
public class GeminiConfig {

    /**
     * API key, sent as the {@code x-goog-api-key} header. Set via environment variable GEMINI_KEY.
     */
    private String apiKey;

    private String chatModel = "gemini-2.0-flash";

    private String baseUrl = "https://generativelanguage.googleapis.com";

    private String apiVersion = "v1beta";

    /**
     * Upper bound for one generateContent call, retries included.
     */
    private Duration timeout = Duration.ofSeconds(60);

    private RetryConfig retry = new RetryConfig();

    /**
     * Retry configuration for transient Gemini API failures (rate limits, 5xx).
     */
    @Data
    public static class RetryConfig {

        private int maxAttempts = 3;

        /**
         * Delay before the first retry. Later retries back off exponentially.
         */
        private long initialBackoffSeconds = 2;

        private long maxBackoffSeconds = 10;

        /**
         * HTTP status codes that trigger a retry. Empty means 429 and any 5xx.
         */
        private List<Integer> retryableStatusCodes = List.of(429, 500, 502, 503, 504);
    }
}
