package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

/**
 * Waterfall step that produced a session, used as a metric tag.
 */
public enum SessionStep {
    DIRECT_REDIRECT,
    STATIC_SCRIPT,
    INITIALIZE_SESSION,
    BACKOFFICE_SCRIPT,
    HPP_ORDER,
    FALLBACK_SCRIPT,
    FAILED,
    ERROR
}
