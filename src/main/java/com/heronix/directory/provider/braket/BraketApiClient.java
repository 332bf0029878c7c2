package com.heronix.directory.provider.braket;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.directory.config.DirectoryProperties;
import com.heronix.directory.exception.ProviderException;
import com.heronix.directory.model.domain.Region;

import lombok.extern.slf4j.Slf4j;

/**
 * Low-level client for the regional Braket device REST API.
 *
 * Request signing happens upstream: the configured credential is sent as-is in the
 * configured header. Every failure leaves this class as a {@link ProviderException}.
 *
 * @author Heronix Development Team
 * @version 1.0.0 - REST client implementation
 */
@Component
@Slf4j
public class BraketApiClient {

    static final String ERROR_TYPE_HEADER = "x-amzn-ErrorType";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final WebClient.Builder webClientBuilder;
    private final DirectoryProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<Region, WebClient> clients = new ConcurrentHashMap<>();

    public BraketApiClient(WebClient.Builder webClientBuilder, DirectoryProperties properties,
                           ObjectMapper objectMapper) {
        this.webClientBuilder = webClientBuilder;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Search the devices of one region (SearchDevices).
     */
    public Map<String, Object> searchDevices(Region region, String nextToken) {
        WebClient client = clientFor(region);

        Map<String, Object> body = new HashMap<>();
        body.put("filters", List.of());
        body.put("maxResults", properties.getProvider().getPageSize());
        if (nextToken != null) {
            body.put("nextToken", nextToken);
        }

        try {
            Map<String, Object> response = client.post()
                    .uri("/devices")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JSON_OBJECT)
                    .block(requestTimeout());

            return response != null ? response : Map.of();

        } catch (Exception e) {
            throw translate(region, "SearchDevices", e);
        }
    }

    /**
     * Describe one device (GetDevice).
     */
    public Map<String, Object> getDevice(Region region, String deviceArn) {
        WebClient client = clientFor(region);

        try {
            Map<String, Object> response = client.get()
                    .uri("/device/{deviceArn}", deviceArn)
                    .retrieve()
                    .bodyToMono(JSON_OBJECT)
                    .block(requestTimeout());

            if (response == null) {
                throw new ProviderException(region.code(), "EmptyResponse", 200,
                        "Empty response describing " + deviceArn);
            }
            return response;

        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            throw translate(region, "GetDevice", e);
        }
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private WebClient clientFor(Region region) {
        String token = properties.getProvider().getAuthToken();
        if (token == null || token.isBlank()) {
            throw ProviderException.missingCredentials(region.code());
        }
        return clients.computeIfAbsent(region, r -> webClientBuilder.clone()
                .baseUrl(endpointFor(r))
                .defaultHeader(properties.getProvider().getAuthHeader(), token)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build());
    }

    String endpointFor(Region region) {
        return properties.getProvider().getEndpointTemplate().replace("{region}", region.code());
    }

    private Duration requestTimeout() {
        return properties.getFanout().getRegionTimeout();
    }

    private ProviderException translate(Region region, String operation, Exception e) {
        if (e instanceof WebClientResponseException response) {
            String code = errorCode(response);
            log.debug("BRAKET: {} in {} returned HTTP {} ({})",
                    operation, region, response.getStatusCode().value(), code);
            return new ProviderException(region.code(), code, response.getStatusCode().value(),
                    operation + " failed in " + region + ": "
                            + (code != null ? code : "HTTP " + response.getStatusCode().value()), e);
        }
        log.debug("BRAKET: {} in {} failed before a response: {}", operation, region, e.getMessage());
        return new ProviderException(region.code(), null, 0,
                operation + " failed in " + region + ": " + e.getMessage(), e);
    }

    /**
     * Error code from the x-amzn-ErrorType header, falling back to the {@code __type}
     * body field. Both may carry a qualifier that is stripped.
     */
    String errorCode(WebClientResponseException response) {
        String header = response.getHeaders().getFirst(ERROR_TYPE_HEADER);
        if (header != null && !header.isBlank()) {
            int colon = header.indexOf(':');
            return colon >= 0 ? header.substring(0, colon) : header;
        }

        String body = response.getResponseBodyAsString();
        if (body.isBlank()) {
            return null;
        }
        try {
            Object type = objectMapper.readValue(body, Map.class).get("__type");
            if (type instanceof String value && !value.isBlank()) {
                int hash = value.lastIndexOf('#');
                return hash >= 0 ? value.substring(hash + 1) : value;
            }
        } catch (JsonProcessingException e) {
            log.debug("BRAKET: Unparseable error body: {}", e.getOriginalMessage());
        }
        return null;
    }
}
