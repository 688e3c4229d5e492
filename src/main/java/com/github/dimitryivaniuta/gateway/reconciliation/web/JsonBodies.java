package com.github.dimitryivaniuta.gateway.reconciliation.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Parses raw webhook bodies. Handlers need the raw text for persistence and the tree for routing.
 */
final class JsonBodies {

    private JsonBodies() {
    }

    /**
     * @param mapper JSON mapper
     * @param raw body text
     * @return JSON object
     * @throws ErrorResponseException 400 when the body is not a JSON object
     */
    static JsonNode parseObject(ObjectMapper mapper, String raw) {
        try {
            JsonNode node = raw == null ? null : mapper.readTree(raw);
            if (node != null && node.isObject()) {
                return node;
            }
        } catch (JsonProcessingException ex) {
            throw badRequest("Request body is not valid JSON: " + ex.getOriginalMessage());
        }
        throw badRequest("Request body must be a JSON object");
    }

    static ErrorResponseException badRequest(String detail) {
        return new ErrorResponseException(HttpStatus.BAD_REQUEST,
                ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail), null);
    }
}
