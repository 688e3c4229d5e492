package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator-facing explanation of why session initialization fell through.
 */
final class SessionDiagnostics {

    static final String HEADLINE = "NetValve payment session could not be initialized.";

    private SessionDiagnostics() {
    }

    /**
     * @param apiCredentialsPresent client id and API key configured
     * @param tokenObtained backoffice sign-in succeeded
     * @param scriptFound backoffice listed a usable script
     * @param hpp hosted-page fallback result
     * @return multi-line diagnostic
     */
    static String build(boolean apiCredentialsPresent, boolean tokenObtained, boolean scriptFound, HppOrderResult hpp) {
        List<String> lines = new ArrayList<>();
        lines.add(HEADLINE);
        lines.add("");

        if (!apiCredentialsPresent) {
            lines.add("SESSION: initializeSession skipped, set NETVALVE_CLIENT_ID and NETVALVE_API_KEY.");
        }
        if (!tokenObtained) {
            lines.add("AUTH: Backoffice sign-in failed. Check NETVALVE_BASIC_AUTH_USERNAME and NETVALVE_BASIC_AUTH_PASSWORD.");
        } else if (!scriptFound) {
            lines.add("HPF: No active HPF script found in the backoffice. "
                    + "Ensure HPF scripts are configured in the NetValve admin panel.");
        }

        if (HppOrderResult.REASON_NO_BEARER_TOKEN.equals(hpp.reason())) {
            lines.add("HPP: No Bearer token available for HPP API.");
        } else if (hpp.hadUnauthorizedAttempt()) {
            lines.add("HPP: Bearer token rejected by HPP API (401). "
                    + "The HPP API may use a different token than the backoffice.");
        } else if (hpp.reason() != null) {
            lines.add("HPP: " + hpp.reason());
        }

        lines.add("");
        lines.add("QUICK FIX: set one of these:");
        lines.add("  * NETVALVE_HPF_SCRIPT_SRC=<url>   hosted-fields script URL");
        lines.add("  * NETVALVE_HPP_DIRECT_URL=<url>   pre-built hosted-page redirect URL");
        return String.join("\n", lines);
    }
}
