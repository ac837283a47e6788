package com.claimvoyant.client.impl;

import com.claimvoyant.client.SecretStore;
import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.configuration.WeaviateProperties;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.ServiceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Builds the Weaviate {@link WebClient} on first use.
 *
 * <p>The cluster URL and API key come from {@code app.weaviate.url}/{@code api-key}
 * when configured, otherwise from the JSON secret named by
 * {@code app.weaviate.secret-name} (keys {@code url} and {@code api_key}).
 * The secret is read once; later calls reuse the client.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeaviateConnectionFactory {

    private final AppProperties props;
    private final SecretStore secretStore;

    private volatile WebClient client;

    public WebClient getClient() {
        WebClient current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = connect();
                    client = current;
                }
            }
        }
        return current;
    }

    private WebClient connect() {
        WeaviateProperties weaviate = props.getWeaviate();
        String url = weaviate.getUrl();
        String apiKey = weaviate.getApiKey();

        if (url == null || url.isBlank()) {
            Map<String, String> secret = secretStore.getSecret(weaviate.getSecretName());
            url = secret.get("url");
            apiKey = secret.get("api_key");
        }
        if (url == null || url.isBlank()) {
            throw new CapabilityException(ServiceType.WEAVIATE, "connect",
                    "no cluster url configured or found in secret " + weaviate.getSecretName());
        }
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            url = "https://" + url;
        }

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(url)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }

        log.info("✅ Weaviate client configured for {}", url);
        return builder.build();
    }
}
