package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Authorization result: the outcome and the annotated session data to persist.
 *
 * @param outcome outcome
 * @param data session data with the authorization fields merged in
 */
public record AuthorizationResult(@JsonIgnore AuthorizationOutcome outcome, ObjectNode data) {

    /**
     * @return {@code authorized} or {@code requires_more}
     */
    @JsonProperty("status")
    public String status() {
        return outcome.status();
    }
}
