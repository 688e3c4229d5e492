package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

/**
 * Payment action a gateway webhook maps to.
 */
public enum WebhookAction {
    AUTHORIZED,
    SUCCESSFUL,
    PENDING,
    REQUIRES_MORE,
    FAILED,
    CANCELED,
    NOT_SUPPORTED
}
