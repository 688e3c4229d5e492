package com.github.dimitryivaniuta.gateway.reconciliation.fulfillment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Outcome of a fulfillment backend call.
 *
 * @param success true for 200, 201 and 204
 * @param message human readable summary
 * @param statusCode upstream status; 500 for transport failures, 400 when authentication failed
 * @param data parsed body; an empty object for 204, {@code {"message": text}} for non-JSON error bodies,
 *             null when no response was received
 */
public record BackendResponse(boolean success, String message, int statusCode, JsonNode data) {

    /**
     * @param field top-level field
     * @return field value or a missing node
     */
    public JsonNode field(String field) {
        if (data == null) {
            return MissingNode.getInstance();
        }
        return data.path(field);
    }
}
