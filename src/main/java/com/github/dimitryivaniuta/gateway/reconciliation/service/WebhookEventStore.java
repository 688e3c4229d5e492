package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.github.dimitryivaniuta.gateway.reconciliation.domain.WebhookEvent;
import java.util.Optional;

/**
 * Durable store of {@link WebhookEvent} rows.
 *
 * <p>Implementations must enforce uniqueness of {@code eventId} and report a duplicate insert as
 * {@link org.springframework.dao.DataIntegrityViolationException}.</p>
 */
public interface WebhookEventStore {

    /**
     * @param eventId provider event id
     * @return row if present
     */
    Optional<WebhookEvent> findByEventId(String eventId);

    /**
     * Inserts a new row and makes it visible to other transactions before returning.
     *
     * @param event new row
     * @return stored row
     * @throws org.springframework.dao.DataIntegrityViolationException when the event id already exists
     */
    WebhookEvent create(WebhookEvent event);

    /**
     * Atomically clears the error of a failed row.
     *
     * @param id row id
     * @return true when this caller cleared it
     */
    boolean claimForRetry(String id);

    /**
     * @param id row id
     */
    void markProcessed(String id);

    /**
     * @param id row id
     * @param message failure description
     */
    void markFailed(String id, String message);
}
