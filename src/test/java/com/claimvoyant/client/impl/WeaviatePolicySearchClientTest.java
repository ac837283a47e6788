package com.claimvoyant.client.impl;

import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.ServiceType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Weaviate Policy Search Client Tests")
class WeaviatePolicySearchClientTest {

    @Mock
    private WeaviateConnectionFactory connectionFactory;

    private WeaviatePolicySearchClient client;
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        client = new WeaviatePolicySearchClient(connectionFactory, new AppProperties(), new ObjectMapper());
    }

    @Test
    @DisplayName("Hits under data.Get.PolicyDocuments are returned as maps")
    void hybridSearch_Hit_ShouldReturnPolicy() {
        respondWith(HttpStatus.OK, """
                {"data": {"Get": {"PolicyDocuments": [
                  {"policy_id": "AUTO-042", "coverage_type": "Comprehensive", "deductible": 500,
                   "coverage_limit": 50000, "filing_deadline_days": 30, "content": "Collision covered."}
                ]}}}
                """);

        List<Map<String, Object>> hits = client.hybridSearch("AUTO-042", 1);

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0))
                .containsEntry("policy_id", "AUTO-042")
                .containsEntry("deductible", 500)
                .containsEntry("filing_deadline_days", 30);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/v1/graphql");
    }

    @Test
    @DisplayName("An empty collection result is an empty list, not a fault")
    void hybridSearch_NoMatch_ShouldReturnEmpty() {
        respondWith(HttpStatus.OK, "{\"data\": {\"Get\": {\"PolicyDocuments\": []}}}");

        assertThat(client.hybridSearch("AUTO-999", 1)).isEmpty();
    }

    @Test
    @DisplayName("A GraphQL errors array is a Weaviate fault")
    void hybridSearch_GraphQlErrors_ShouldThrow() {
        respondWith(HttpStatus.OK, """
                {"data": {"Get": {"PolicyDocuments": null}},
                 "errors": [{"message": "Cannot query field \\"policy_id\\" on type \\"PolicyDocuments\\""}]}
                """);

        assertThatThrownBy(() -> client.hybridSearch("AUTO-042", 1))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("Cannot query field")
                .extracting("service").isEqualTo(ServiceType.WEAVIATE);
    }

    @Test
    @DisplayName("An empty body is a Weaviate fault")
    void hybridSearch_EmptyBody_ShouldThrow() {
        when(connectionFactory.getClient()).thenReturn(webClient(ClientResponse.create(HttpStatus.OK).build()));

        assertThatThrownBy(() -> client.hybridSearch("AUTO-042", 1))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("empty response")
                .extracting("service").isEqualTo(ServiceType.WEAVIATE);
    }

    @Test
    @DisplayName("HTTP errors are wrapped as Weaviate faults")
    void hybridSearch_ServerError_ShouldThrow() {
        respondWith(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\": \"boom\"}");

        assertThatThrownBy(() -> client.hybridSearch("AUTO-042", 1))
                .isInstanceOf(CapabilityException.class)
                .extracting("service").isEqualTo(ServiceType.WEAVIATE);
    }

    private void respondWith(HttpStatus status, String json) {
        when(connectionFactory.getClient()).thenReturn(webClient(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build()));
    }

    private WebClient webClient(ClientResponse response) {
        return WebClient.builder()
                .baseUrl("http://weaviate.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(response);
                })
                .build();
    }
}
