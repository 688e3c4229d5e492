package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

/**
 * How an authorization attempt ended. Everything except {@link #AUTHORIZED} is reported to the
 * storefront as {@code requires_more}.
 */
public enum AuthorizationOutcome {
    /** Sale approved, already approved earlier, or proven by a hosted-page or webhook id. */
    AUTHORIZED("authorized"),
    /** No card data or proof yet; the storefront must collect card input. */
    REQUIRES_INPUT("requires_more"),
    /** The gateway declined the sale. */
    DECLINED("requires_more"),
    /** Flags were set but nothing proves an authorization. */
    UNVERIFIED("requires_more");

    private final String status;

    AuthorizationOutcome(String status) {
        this.status = status;
    }

    /**
     * @return payment session status
     */
    public String status() {
        return status;
    }
}
