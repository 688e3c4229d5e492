package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

/**
 * Sale payment type: a fresh hosted-fields card token or a stored card token.
 */
public enum PaymentType {
    CARD,
    TOKEN
}
