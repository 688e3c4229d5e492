package com.github.dimitryivaniuta.gateway.reconciliation.http;

import java.net.URI;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Status, headers and body text of an HTTP response, whatever its status.
 *
 * <p>Upstream APIs put meaningful JSON in 4xx bodies, so error statuses are returned as values here.
 * Only transport failures (connect, timeout, I/O) surface as {@link RestClientException}.</p>
 *
 * @param status HTTP status code
 * @param headers response headers
 * @param body body text, never null
 */
public record RawResponse(int status, HttpHeaders headers, String body) {

    /**
     * Executes a request and captures the response.
     *
     * @param rest rest template
     * @param url absolute URL, already encoded
     * @param method HTTP method
     * @param request headers and body
     * @return response
     * @throws RestClientException on transport failure
     */
    public static RawResponse exchange(RestTemplate rest, String url, HttpMethod method, HttpEntity<?> request) {
        return exchange(rest, URI.create(url), method, request);
    }

    /**
     * Executes a request and captures the response.
     *
     * @param rest rest template
     * @param uri absolute URI
     * @param method HTTP method
     * @param request headers and body
     * @return response
     * @throws RestClientException on transport failure
     */
    public static RawResponse exchange(RestTemplate rest, URI uri, HttpMethod method, HttpEntity<?> request) {
        try {
            ResponseEntity<String> resp = rest.exchange(uri, method, request, String.class);
            return new RawResponse(resp.getStatusCode().value(), resp.getHeaders(), nullToEmpty(resp.getBody()));
        } catch (RestClientResponseException ex) {
            HttpHeaders headers = ex.getResponseHeaders() == null ? new HttpHeaders() : ex.getResponseHeaders();
            return new RawResponse(ex.getStatusCode().value(), headers, nullToEmpty(ex.getResponseBodyAsString()));
        }
    }

    /**
     * @return true when the response declares a JSON content type
     */
    public boolean isJsonContent() {
        MediaType type = headers.getContentType();
        return type != null && (MediaType.APPLICATION_JSON.isCompatibleWith(type) || type.getSubtype().endsWith("+json"));
    }

    /**
     * @return true when the body has non-whitespace content
     */
    public boolean hasBody() {
        return !body.isBlank();
    }

    /**
     * @param max max length
     * @return body truncated to {@code max} characters
     */
    public String bodyPrefix(int max) {
        return body.length() > max ? body.substring(0, max) : body;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
