package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.http.RawResponse;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Calls to the NetValve payment API authenticated with the client id and API key headers.
 */
@Component
public class NetValveGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(NetValveGatewayClient.class);

    static final String CLIENT_ID_HEADER = "netvalve-client-id";
    static final String API_KEY_HEADER = "netvalve-api-key";

    private final NetValveHttpClients clients;
    private final NetValveEndpoints endpoints;
    private final ObjectMapper objectMapper;

    /**
     * Creates the client.
     *
     * @param clients NetValve HTTP clients
     * @param endpoints URL and credential resolver
     * @param objectMapper JSON mapper
     */
    public NetValveGatewayClient(NetValveHttpClients clients, NetValveEndpoints endpoints, ObjectMapper objectMapper) {
        this.clients = clients;
        this.endpoints = endpoints;
        this.objectMapper = objectMapper;
    }

    /**
     * @return true when both the client id and the API key are configured
     */
    public boolean hasApiCredentials() {
        return !endpoints.clientId().isEmpty() && !endpoints.apiKey().isEmpty();
    }

    /**
     * {@code GET /hpf/initializeSession}.
     *
     * @return session data carrying {@code netvalveScriptSrc} or {@code paymentToken}; empty on any failure
     */
    public Optional<JsonNode> initializeSession() {
        if (!hasApiCredentials()) {
            log.error("NetValve HPF initializeSession: missing client id or API key");
            return Optional.empty();
        }
        String url = endpoints.paymentApiUrl() + "/hpf/initializeSession";
        HttpHeaders headers = new HttpHeaders();
        headers.set(CLIENT_ID_HEADER, endpoints.clientId());
        headers.set(API_KEY_HEADER, endpoints.apiKey());

        try {
            RawResponse resp = RawResponse.exchange(clients.session(), url, HttpMethod.GET, new HttpEntity<>(headers));
            if (resp.status() != 200) {
                log.error("NetValve HPF initializeSession failed: HTTP {} {}", resp.status(), resp.bodyPrefix(500));
                return Optional.empty();
            }
            JsonNode data = objectMapper.readTree(resp.body());
            if (!hasText(data, "netvalveScriptSrc") && !hasText(data, "paymentToken")) {
                log.error("NetValve HPF initializeSession: no script src or paymentToken in response");
                return Optional.empty();
            }
            return Optional.of(data);
        } catch (RestClientException | JsonProcessingException ex) {
            log.error("NetValve HPF initializeSession error: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * {@code POST /sale}.
     *
     * @param payload sale payload
     * @return response of any status
     * @throws RestClientException on transport failure
     */
    public RawResponse postSale(Map<String, Object> payload) {
        return post(clients.sale(), "/sale", payload);
    }

    /**
     * {@code POST /capture}, {@code /refund} or {@code /cancel}.
     *
     * @param path operation path
     * @param payload request payload
     * @return response of any status
     * @throws RestClientException on transport failure
     */
    public RawResponse postTransaction(String path, Map<String, Object> payload) {
        return post(clients.order(), path, payload);
    }

    private RawResponse post(RestTemplate rest, String path, Map<String, Object> payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(CLIENT_ID_HEADER, endpoints.clientId());
        headers.set(API_KEY_HEADER, endpoints.apiKey());
        return RawResponse.exchange(rest, endpoints.paymentApiUrl() + path, HttpMethod.POST, new HttpEntity<>(payload, headers));
    }

    private static boolean hasText(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isTextual() && !v.asText().isEmpty();
    }
}
