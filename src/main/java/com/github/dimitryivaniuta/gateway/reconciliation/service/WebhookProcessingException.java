package com.github.dimitryivaniuta.gateway.reconciliation.service;

/**
 * A multi-step webhook flow failed at an identified step.
 *
 * <p>The message is recorded on the event row and the exception is mapped to HTTP 500, which makes the
 * provider redeliver and the next delivery retry the flow.</p>
 */
public class WebhookProcessingException extends RuntimeException {

    private final String step;

    /**
     * @param step step label, e.g. {@code cart_lookup}
     * @param message cause description
     */
    public WebhookProcessingException(String step, String message) {
        super(message);
        this.step = step;
    }

    /**
     * @param step step label
     * @param message cause description
     * @param cause underlying exception
     */
    public WebhookProcessingException(String step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    /**
     * @return failing step label
     */
    public String getStep() {
        return step;
    }

    /**
     * @return text stored in the event row
     */
    public String describe() {
        return step + ": " + getMessage();
    }
}
