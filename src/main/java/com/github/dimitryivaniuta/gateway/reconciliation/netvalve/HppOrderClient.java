package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.config.AppProperties;
import com.github.dimitryivaniuta.gateway.reconciliation.http.RawResponse;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HppAttempt;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HppEndpoint;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.SessionRequest;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
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
 * Creates a hosted-page order when no hosted-fields script is available.
 *
 * <p>Candidate endpoints are every configured host combined with every known path. The first JSON
 * response below 400 carrying a redirect URL wins.</p>
 */
@Component
public class HppOrderClient {

    private static final Logger log = LoggerFactory.getLogger(HppOrderClient.class);

    private static final int ATTEMPT_BODY_LIMIT = 500;
    private static final List<String> REDIRECT_KEYS = List.of("redirectUrl", "redirect_url", "url", "paymentUrl", "payment_url");
    private static final List<String> NESTED_KEYS = List.of("data", "payload", "order");

    private final RestTemplate rest;
    private final NetValveEndpoints endpoints;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Creates the client.
     *
     * @param clients NetValve HTTP clients
     * @param endpoints URL and credential resolver
     * @param objectMapper JSON mapper
     * @param clock clock for generated order ids
     */
    public HppOrderClient(NetValveHttpClients clients, NetValveEndpoints endpoints, ObjectMapper objectMapper, Clock clock) {
        this.rest = clients.order();
        this.endpoints = endpoints;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Attempts to create a hosted-page order.
     *
     * @param bearerToken backoffice token, may be null
     * @param request session request
     * @return result with every attempt recorded
     */
    public HppOrderResult createOrder(String bearerToken, SessionRequest request) {
        AppProperties.Hpp hpp = endpoints.hpp();
        if (!hpp.isFallbackEnabled()) {
            return HppOrderResult.failed(HppOrderResult.REASON_DISABLED);
        }
        if (bearerToken == null || bearerToken.isBlank()) {
            return HppOrderResult.failed(HppOrderResult.REASON_NO_BEARER_TOKEN);
        }
        BigDecimal amount = request.amount();
        if (amount == null || amount.signum() <= 0) {
            return HppOrderResult.failed(HppOrderResult.REASON_MISSING_AMOUNT);
        }
        String currency = request.normalizedCurrency() == null ? "USD" : request.normalizedCurrency();
        String midId = endpoints.midIdFor(currency);
        String siteId = endpoints.siteId();
        if (midId.isEmpty() || siteId.isEmpty()) {
            return HppOrderResult.failed(HppOrderResult.REASON_MISSING_SITE_OR_MID);
        }

        Map<String, Object> payload = buildPayload(request, amount, currency, siteId, midId);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(bearerToken);
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(payload, headers);

        List<HppAttempt> attempts = new ArrayList<>();
        for (HppEndpoint candidate : candidates()) {
            RawResponse resp;
            try {
                resp = RawResponse.exchange(rest, candidate.url(), HttpMethod.POST, entity);
            } catch (RestClientException | IllegalArgumentException ex) {
                attempts.add(new HppAttempt(candidate.method(), candidate.url(), 0, String.valueOf(ex.getMessage())));
                continue;
            }
            attempts.add(new HppAttempt(candidate.method(), candidate.url(), resp.status(), resp.bodyPrefix(ATTEMPT_BODY_LIMIT)));

            if (resp.status() >= 400 || !resp.isJsonContent()) {
                continue;
            }
            JsonNode parsed;
            try {
                parsed = objectMapper.readTree(resp.body());
            } catch (JsonProcessingException ex) {
                continue;
            }
            String redirectUrl = findRedirectUrl(parsed);
            if (redirectUrl != null) {
                log.info("NetValve HPP order created via {}", candidate.url());
                return new HppOrderResult(true, redirectUrl, parsed, candidate, List.copyOf(attempts), null);
            }
        }

        log.warn("NetValve HPP fallback produced no redirect after {} attempts", attempts.size());
        return HppOrderResult.failed(HppOrderResult.REASON_NO_REDIRECT, attempts);
    }

    /**
     * @return hosts (configured order host, HPP base) times paths (configured, /hpp/order, /order), de-duplicated
     */
    List<HppEndpoint> candidates() {
        AppProperties.Hpp hpp = endpoints.hpp();
        List<String> hosts = new ArrayList<>();
        addIfText(hosts, hpp.getOrderHost());
        addIfText(hosts, endpoints.hppBaseUrl());

        List<String> paths = new ArrayList<>();
        for (String p : new String[] {hpp.getOrderPath(), "/hpp/order", "/order"}) {
            if (p != null && !p.isBlank()) {
                String trimmed = p.trim();
                paths.add(trimmed.startsWith("/") ? trimmed : "/" + trimmed);
            }
        }

        Set<String> seen = new LinkedHashSet<>();
        for (String host : hosts) {
            String base = host.replaceAll("/+$", "");
            for (String path : paths) {
                seen.add(base + path);
            }
        }
        return seen.stream().map(url -> new HppEndpoint("POST", url)).toList();
    }

    /**
     * Looks for a redirect URL at the root, then under {@code data}, {@code payload} and {@code order}.
     *
     * @param response order response
     * @return trimmed URL, null when none
     */
    static String findRedirectUrl(JsonNode response) {
        List<JsonNode> sources = new ArrayList<>();
        sources.add(response);
        for (String key : NESTED_KEYS) {
            if (response.path(key).isObject()) {
                sources.add(response.path(key));
            }
        }
        for (JsonNode source : sources) {
            for (String key : REDIRECT_KEYS) {
                JsonNode v = source.path(key);
                if (v.isTextual() && !v.asText().isBlank()) {
                    return v.asText().trim();
                }
            }
        }
        return null;
    }

    private Map<String, Object> buildPayload(SessionRequest request, BigDecimal amount, String currency, String siteId, String midId) {
        AppProperties.Hpp hpp = endpoints.hpp();
        String returnBase = NetValveEndpoints.firstText(hpp.getReturnBaseUrl(), "http://localhost:8000");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("mode", NetValveEndpoints.firstText(hpp.getMode(), "SALE"));
        payload.put("amount", amount);
        payload.put("currency", currency);
        payload.put("siteId", siteId);
        payload.put("netvalveMidId", midId);
        payload.put("clientOrderId", NetValveEndpoints.firstText(request.cartId(), "cart_" + clock.instant().getEpochSecond()));
        payload.put("orderDesc", NetValveEndpoints.firstText(request.orderDesc(), "Medusa checkout"));
        payload.put("successUrl", returnUrl(request.successUrl(), hpp.getSuccessUrl(), returnBase, "success"));
        payload.put("cancelUrl", returnUrl(request.cancelUrl(), hpp.getCancelUrl(), returnBase, "cancel"));
        payload.put("failedUrl", returnUrl(request.failedUrl(), hpp.getFailedUrl(), returnBase, "failed"));
        payload.put("pendingUrl", returnUrl(request.pendingUrl(), hpp.getPendingUrl(), returnBase, "pending"));
        return payload;
    }

    private static String returnUrl(String requested, String configured, String returnBase, String status) {
        return NetValveEndpoints.firstText(requested, configured,
                returnBase + "/checkout-v2/payment?netvalve_status=" + status.toLowerCase(Locale.ROOT));
    }

    private static void addIfText(List<String> list, String value) {
        if (value != null && !value.isBlank()) {
            list.add(value.trim());
        }
    }
}
