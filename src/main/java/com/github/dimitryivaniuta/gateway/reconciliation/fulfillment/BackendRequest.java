package com.github.dimitryivaniuta.gateway.reconciliation.fulfillment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpMethod;

/**
 * Call against the fulfillment backend.
 *
 * @param endpoint path template relative to the backend base URL, e.g. {@code /store/carts/{cartId}}
 * @param pathVariables values for the endpoint template, encoded on expansion
 * @param method HTTP method
 * @param payload JSON body, may be null
 * @param params query parameters
 * @param headers extra headers; an explicit {@code Authorization} disables admin token injection
 * @param includePublishableKey add {@code x-publishable-api-key} unless already present
 */
public record BackendRequest(
        String endpoint,
        Map<String, String> pathVariables,
        HttpMethod method,
        Object payload,
        Map<String, String> params,
        Map<String, String> headers,
        boolean includePublishableKey
) {

    public BackendRequest {
        pathVariables = pathVariables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(pathVariables));
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * @param endpoint path
     * @return GET request
     */
    public static BackendRequest get(String endpoint) {
        return new BackendRequest(endpoint, null, HttpMethod.GET, null, null, null, false);
    }

    /**
     * @param endpoint path
     * @param payload body, may be null
     * @return POST request
     */
    public static BackendRequest post(String endpoint, Object payload) {
        return new BackendRequest(endpoint, null, HttpMethod.POST, payload, null, null, false);
    }

    /**
     * @param name template variable of the endpoint
     * @param value value, encoded as one path segment
     * @return copy with the variable bound
     */
    public BackendRequest withPathVariable(String name, String value) {
        Map<String, String> v = new LinkedHashMap<>(pathVariables);
        v.put(name, value);
        return new BackendRequest(endpoint, v, method, payload, params, headers, includePublishableKey);
    }

    /**
     * @param name query parameter
     * @param value value
     * @return copy with the parameter added
     */
    public BackendRequest withParam(String name, String value) {
        Map<String, String> p = new LinkedHashMap<>(params);
        p.put(name, value);
        return new BackendRequest(endpoint, pathVariables, method, payload, p, headers, includePublishableKey);
    }

    /**
     * @param name header
     * @param value value
     * @return copy with the header added
     */
    public BackendRequest withHeader(String name, String value) {
        Map<String, String> h = new LinkedHashMap<>(headers);
        h.put(name, value);
        return new BackendRequest(endpoint, pathVariables, method, payload, params, h, includePublishableKey);
    }

    /**
     * @return copy that carries the storefront publishable key
     */
    public BackendRequest withPublishableKey() {
        return new BackendRequest(endpoint, pathVariables, method, payload, params, headers, true);
    }
}
