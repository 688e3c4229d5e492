package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HppAttempt;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.HppEndpoint;
import java.util.List;

/**
 * Outcome of the hosted-page order fallback.
 *
 * @param success true when a redirect URL was obtained
 * @param redirectUrl redirect URL
 * @param data parsed order response
 * @param endpoint endpoint that answered
 * @param attempts every attempt made, in order
 * @param reason failure reason code
 */
public record HppOrderResult(
        boolean success,
        String redirectUrl,
        JsonNode data,
        HppEndpoint endpoint,
        List<HppAttempt> attempts,
        String reason
) {

    static final String REASON_DISABLED = "hpp_fallback_disabled";
    static final String REASON_NO_BEARER_TOKEN = "hpp_fallback_no_bearer_token";
    static final String REASON_MISSING_AMOUNT = "hpp_fallback_missing_amount";
    static final String REASON_MISSING_SITE_OR_MID = "hpp_fallback_missing_site_or_mid";
    static final String REASON_NO_REDIRECT = "hpp_fallback_no_redirect";

    static HppOrderResult failed(String reason) {
        return new HppOrderResult(false, null, null, null, List.of(), reason);
    }

    static HppOrderResult failed(String reason, List<HppAttempt> attempts) {
        return new HppOrderResult(false, null, null, null, List.copyOf(attempts), reason);
    }

    /**
     * @return true when any attempt was rejected with 401
     */
    public boolean hadUnauthorizedAttempt() {
        return attempts.stream().anyMatch(a -> a.status() == 401);
    }

    /**
     * @param field field of the order response
     * @return text value, null when absent
     */
    public String dataText(String field) {
        if (data == null) {
            return null;
        }
        JsonNode v = data.path(field);
        return v.isValueNode() && !v.isNull() ? v.asText() : null;
    }
}
