package com.catalogcache.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CatalogApi} over the upstream admin GraphQL endpoint.
 */
@Slf4j
public class GraphQlCatalogClient implements CatalogApi {

    static final String ACCESS_TOKEN_HEADER = "X-Shopify-Access-Token";

    private final RestClient restClient;

    public GraphQlCatalogClient(RestClient.Builder builder, String shopDomain, String apiVersion, String accessToken) {
        if (shopDomain == null || shopDomain.isBlank() || accessToken == null || accessToken.isBlank()) {
            throw new IllegalStateException("Upstream shop domain and access token must be configured");
        }

        this.restClient = builder
                .baseUrl("https://" + shopDomain + "/admin/api/" + apiVersion)
                .defaultHeader(ACCESS_TOKEN_HEADER, accessToken)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        log.info("Upstream catalog client initialized: shop={}, apiVersion={}", shopDomain, apiVersion);
    }

    @Override
    public UpstreamResponse execute(String query, Map<String, Object> variables) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("variables", variables == null ? Map.of() : variables);

        final JsonNode body;
        try {
            body = restClient.post()
                    .uri("/graphql.json")
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new UpstreamException("Upstream request failed: " + e.getMessage(), e);
        }

        if (body == null || !body.isObject()) {
            throw new UpstreamException("Upstream returned an empty or non-object body");
        }

        return new UpstreamResponse(body.path("data"), actualCost(body), errorMessages(body));
    }

    private static Double actualCost(JsonNode body) {
        JsonNode cost = body.path("extensions").path("cost").path("actualQueryCost");
        return cost.isNumber() ? cost.asDouble() : null;
    }

    private static List<String> errorMessages(JsonNode body) {
        List<String> messages = new ArrayList<>();
        for (JsonNode error : body.path("errors")) {
            messages.add(error.path("message").asText("unknown error"));
        }
        return messages;
    }
}
