package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.cache.IssuedToken;
import com.github.dimitryivaniuta.gateway.reconciliation.cache.TokenCache;
import com.github.dimitryivaniuta.gateway.reconciliation.http.RawResponse;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HpfScript;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
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

/**
 * NetValve backoffice access: bearer token sign-in and the hosted-fields script list.
 *
 * <p>The token is cached with a pre-expiry refresh buffer (five minutes by default). Failures are
 * logged and reported as empty results.</p>
 */
@Component
public class BackofficeAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(BackofficeAuthenticator.class);

    static final String TOKEN_KEY = "netvalve:backoffice_token";

    private final RestTemplate rest;
    private final TokenCache tokenCache;
    private final ObjectMapper objectMapper;
    private final NetValveEndpoints endpoints;

    /**
     * Creates the authenticator.
     *
     * @param clients NetValve HTTP clients
     * @param tokenCache backoffice token cache
     * @param objectMapper JSON mapper
     * @param endpoints URL and credential resolver
     */
    public BackofficeAuthenticator(
            NetValveHttpClients clients,
            @Qualifier("backofficeTokenCache") TokenCache tokenCache,
            ObjectMapper objectMapper,
            NetValveEndpoints endpoints
    ) {
        this.rest = clients.session();
        this.tokenCache = tokenCache;
        this.objectMapper = objectMapper;
        this.endpoints = endpoints;
    }

    /**
     * @return bearer token, empty when credentials are missing or sign-in failed
     */
    public Optional<String> bearerToken() {
        return tokenCache.getOrRefresh(TOKEN_KEY, this::signIn);
    }

    /**
     * Lists hosted-fields scripts and picks one: the default among usable scripts, else the most
     * recently created.
     *
     * @param bearerToken backoffice token
     * @return script, empty when none is usable or the call failed
     */
    public Optional<HpfScript> fetchActiveScript(String bearerToken) {
        String url = endpoints.backofficeUrl() + "/backoffice/hpf/script";
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(bearerToken);

        try {
            RawResponse resp = RawResponse.exchange(rest, url, HttpMethod.GET, new HttpEntity<>(headers));
            if (resp.status() != 200) {
                log.error("NetValve HPF scripts fetch failed: HTTP {}", resp.status());
                return Optional.empty();
            }
            JsonNode root = objectMapper.readTree(resp.body());
            if (!root.isArray() || root.isEmpty()) {
                return Optional.empty();
            }
            List<HpfScript> scripts = objectMapper.convertValue(root, new TypeReference<List<HpfScript>>() {});
            return pickScript(scripts);
        } catch (RestClientException | JsonProcessingException | IllegalArgumentException ex) {
            log.error("NetValve HPF scripts fetch error: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    static Optional<HpfScript> pickScript(List<HpfScript> scripts) {
        List<HpfScript> usable = scripts.stream().filter(HpfScript::isUsable).toList();
        Optional<HpfScript> preferred = usable.stream().filter(HpfScript::isDefaultScript).findFirst();
        if (preferred.isPresent()) {
            return preferred;
        }
        return usable.stream().max(Comparator.comparing(s -> s.createdDate() == null ? "" : s.createdDate()));
    }

    private Optional<IssuedToken> signIn() {
        String username = endpoints.backoffice().getUsername();
        String password = endpoints.backoffice().getPassword();
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            return Optional.empty();
        }

        String url = endpoints.backofficeUrl() + "/backoffice/users/sign-in";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, String> body = Map.of("userName", username.trim(), "password", password.trim(), "checkForBot", "net");

        try {
            RawResponse resp = RawResponse.exchange(rest, url, HttpMethod.POST, new HttpEntity<>(body, headers));
            if (resp.status() != 200) {
                log.error("NetValve backoffice sign-in failed: HTTP {} {}", resp.status(), resp.bodyPrefix(500));
                return Optional.empty();
            }
            JsonNode data = objectMapper.readTree(resp.body());
            String accessToken = data.path("accessToken").asText("");
            if (accessToken.isBlank()) {
                log.error("NetValve backoffice sign-in: no accessToken in response");
                return Optional.empty();
            }
            Duration lifetime = data.path("expiresIn").canConvertToLong()
                    ? Duration.ofSeconds(data.path("expiresIn").asLong())
                    : endpoints.backoffice().getDefaultTokenLifetime();
            log.info("NetValve backoffice token obtained, expires in {}s", lifetime.toSeconds());
            return Optional.of(new IssuedToken(accessToken, lifetime));
        } catch (RestClientException | JsonProcessingException ex) {
            log.error("NetValve backoffice sign-in error: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
