package com.github.dimitryivaniuta.gateway.reconciliation.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Delivery state of an {@link OutboxEvent}. Stored as VARCHAR.
 */
public enum OutboxStatus {
    /** Written with the reconciliation result, not yet published. */
    NEW(true),
    /** Publishing failed; eligible again at {@code next_attempt_at}. */
    RETRY(true),
    /** Acknowledged by Kafka. */
    SENT(false),
    /** Gave up after the configured number of attempts. */
    DEAD(false);

    private final boolean publishable;

    OutboxStatus(boolean publishable) {
        this.publishable = publishable;
    }

    /**
     * @return true when the dispatcher still picks the row up
     */
    public boolean isPublishable() {
        return publishable;
    }

    /**
     * @return column values of the publishable states, for the dispatcher's native query
     */
    public static List<String> publishableNames() {
        return Arrays.stream(values()).filter(OutboxStatus::isPublishable).map(Enum::name).toList();
    }
}
