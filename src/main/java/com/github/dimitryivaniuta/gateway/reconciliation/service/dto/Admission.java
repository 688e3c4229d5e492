package com.github.dimitryivaniuta.gateway.reconciliation.service.dto;

import com.github.dimitryivaniuta.gateway.reconciliation.domain.WebhookEvent;

/**
 * Result of admitting an event.
 *
 * @param decision decision
 * @param event the admitted row, or the existing row for {@link AdmissionDecision#SKIP}
 */
public record Admission(AdmissionDecision decision, WebhookEvent event) {

    /**
     * @param event newly created row
     * @return execute admission
     */
    public static Admission execute(WebhookEvent event) {
        return new Admission(AdmissionDecision.EXECUTE, event);
    }

    /**
     * @param event row whose error was cleared
     * @return retry admission
     */
    public static Admission retry(WebhookEvent event) {
        return new Admission(AdmissionDecision.RETRY, event);
    }

    /**
     * @param event existing row
     * @return skip admission
     */
    public static Admission skip(WebhookEvent event) {
        return new Admission(AdmissionDecision.SKIP, event);
    }

    /**
     * @return true when the caller owns the side effect
     */
    public boolean shouldRun() {
        return decision.runsSideEffect();
    }

    /**
     * @return row id of the admitted event
     */
    public String rowId() {
        return event == null ? null : event.getId();
    }
}
