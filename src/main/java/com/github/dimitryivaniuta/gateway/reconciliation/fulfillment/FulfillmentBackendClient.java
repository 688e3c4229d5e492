package com.github.dimitryivaniuta.gateway.reconciliation.fulfillment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.gateway.reconciliation.cache.IssuedToken;
import com.github.dimitryivaniuta.gateway.reconciliation.cache.TokenCache;
import com.github.dimitryivaniuta.gateway.reconciliation.config.AppProperties;
import com.github.dimitryivaniuta.gateway.reconciliation.http.RawResponse;
import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Client of the order-fulfillment backend (Medusa admin and store APIs).
 *
 * <ul>
 *   <li>Admin token from {@code POST /auth/user/emailpass}, cached, with exponential backoff between
 *       failed sign-in attempts</li>
 *   <li>Admin token injected as bearer unless the request carries its own {@code Authorization}</li>
 *   <li>A 401 on an injected token evicts it and retries exactly once</li>
 *   <li>Never throws for upstream failures; every outcome is a {@link BackendResponse}</li>
 * </ul>
 */
@Component
public class FulfillmentBackendClient {

    private static final Logger log = LoggerFactory.getLogger(FulfillmentBackendClient.class);

    /**
     * Cache key of the admin token.
     */
    static final String TOKEN_KEY = "fulfillment:admin_token";

    static final String PUBLISHABLE_KEY_HEADER = "x-publishable-api-key";

    private final RestTemplate rest;
    private final TokenCache tokenCache;
    private final ObjectMapper objectMapper;
    private final AppProperties.Fulfillment props;

    /**
     * Creates the client.
     *
     * @param rest rest template with the backend timeout
     * @param tokenCache admin token cache
     * @param objectMapper JSON mapper
     * @param properties application properties
     */
    public FulfillmentBackendClient(
            @Qualifier("fulfillmentRestTemplate") RestTemplate rest,
            @Qualifier("fulfillmentTokenCache") TokenCache tokenCache,
            ObjectMapper objectMapper,
            AppProperties properties
    ) {
        this.rest = rest;
        this.tokenCache = tokenCache;
        this.objectMapper = objectMapper;
        this.props = properties.getFulfillment();
    }

    /**
     * Returns a valid admin token, signing in when the cache has none.
     *
     * @return token, empty when every sign-in attempt failed
     */
    public Optional<String> authenticate() {
        return tokenCache.getOrRefresh(TOKEN_KEY, this::signIn);
    }

    /**
     * Executes a backend call.
     *
     * @param request request
     * @return response
     */
    public BackendResponse execute(BackendRequest request) {
        return execute(request, true);
    }

    private BackendResponse execute(BackendRequest request, boolean retryOn401) {
        HttpHeaders headers = new HttpHeaders();
        request.headers().forEach(headers::set);
        headers.setContentType(MediaType.APPLICATION_JSON);

        boolean injectedAdminToken = false;
        if (!headers.containsKey(HttpHeaders.AUTHORIZATION)) {
            Optional<String> token = authenticate();
            if (token.isEmpty()) {
                return new BackendResponse(false, "Authentication Failed", 400, null);
            }
            headers.setBearerAuth(token.get());
            injectedAdminToken = true;
        }

        if (request.includePublishableKey() && !headers.containsKey(PUBLISHABLE_KEY_HEADER)) {
            headers.set(PUBLISHABLE_KEY_HEADER, props.getPublishableKey());
        }

        URI uri = buildUri(request);
        RawResponse resp;
        try {
            resp = RawResponse.exchange(rest, uri, request.method(), new HttpEntity<>(request.payload(), headers));
        } catch (RestClientException ex) {
            log.error("Fulfillment request {} {} failed: {}", request.method(), request.endpoint(), ex.getMessage());
            return new BackendResponse(false, "Request to " + request.endpoint() + " failed: " + ex.getMessage(), 500, null);
        }

        if (resp.status() == 401 && retryOn401 && injectedAdminToken) {
            log.warn("Fulfillment admin token rejected on {}, re-authenticating once", request.endpoint());
            tokenCache.evict(TOKEN_KEY);
            return execute(request, false);
        }

        if (resp.status() == 200 || resp.status() == 201 || resp.status() == 204) {
            if (resp.status() == 204 || !resp.hasBody()) {
                return new BackendResponse(true, "Calling " + request.endpoint() + " successful", resp.status(), objectMapper.createObjectNode());
            }
            try {
                JsonNode data = objectMapper.readTree(resp.body());
                return new BackendResponse(true, "Calling " + request.endpoint() + " successful", resp.status(), data);
            } catch (JsonProcessingException ex) {
                log.error("Fulfillment response of {} is not JSON: {}", request.endpoint(), resp.bodyPrefix(200));
                return new BackendResponse(false, "Request to " + request.endpoint() + " failed: " + ex.getOriginalMessage(), 500, null);
            }
        }

        return new BackendResponse(false, "Request to " + request.endpoint() + " failed", resp.status(), errorData(resp));
    }

    private JsonNode errorData(RawResponse resp) {
        if (!resp.hasBody()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(resp.body());
        } catch (JsonProcessingException ex) {
            ObjectNode wrapped = objectMapper.createObjectNode();
            wrapped.put("message", resp.body());
            return wrapped;
        }
    }

    private URI buildUri(BackendRequest request) {
        UriComponentsBuilder b = UriComponentsBuilder.fromHttpUrl(props.getBaseUrl()).path(request.endpoint());
        Map<String, Object> vars = new HashMap<>(request.pathVariables());
        int i = 0;
        for (Map.Entry<String, String> param : request.params().entrySet()) {
            // query values get their own variable names so they cannot collide with path variables
            String var = "query" + i++;
            b.queryParam(param.getKey(), "{" + var + "}");
            vars.put(var, param.getValue());
        }
        return b.encode().buildAndExpand(vars).toUri();
    }

    private Optional<IssuedToken> signIn() {
        if (props.getAdminEmail().isBlank() || props.getAdminPassword().isBlank()) {
            log.error("Fulfillment admin credentials are not configured");
            return Optional.empty();
        }

        String url = props.getBaseUrl() + "/auth/user/emailpass";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, String> body = Map.of("email", props.getAdminEmail(), "password", props.getAdminPassword());

        int attempts = Math.max(1, props.getAuthAttempts());
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                RawResponse resp = RawResponse.exchange(rest, url, HttpMethod.POST, new HttpEntity<>(body, headers));
                if (resp.status() == 200) {
                    String token = objectMapper.readTree(resp.body()).path("token").asText("");
                    if (!token.isBlank()) {
                        log.info("Fulfillment admin token obtained");
                        return Optional.of(new IssuedToken(token, props.getTokenTtl()));
                    }
                }
                log.warn("Fulfillment auth attempt {}/{} failed: HTTP {}", attempt + 1, attempts, resp.status());
            } catch (RestClientException | JsonProcessingException ex) {
                log.warn("Fulfillment auth attempt {}/{} error: {}", attempt + 1, attempts, ex.getMessage());
            }

            if (attempt < attempts - 1 && !pause(props.getAuthBackoff().multipliedBy(1L << attempt))) {
                break;
            }
        }

        log.error("Fulfillment auth failed after {} attempts", attempts);
        return Optional.empty();
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
