package com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto;

/**
 * Result of the session waterfall: a 200 session or a 5xx failure.
 *
 * @param httpStatus status to answer with
 * @param session session, set when {@code httpStatus == 200}
 * @param failure failure, set otherwise
 */
public record SessionOutcome(int httpStatus, HpfSessionResponse session, SessionFailure failure) {

    public static SessionOutcome ok(HpfSessionResponse session) {
        return new SessionOutcome(200, session, null);
    }

    public static SessionOutcome failed(int httpStatus, SessionFailure failure) {
        return new SessionOutcome(httpStatus, null, failure);
    }

    /**
     * @return response body
     */
    public Object body() {
        return session != null ? session : failure;
    }
}
