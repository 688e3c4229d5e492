package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.github.dimitryivaniuta.gateway.reconciliation.domain.WebhookEvent;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Store fake with the same uniqueness and claim semantics as the JPA store.
 */
class InMemoryWebhookEventStore implements WebhookEventStore {

    private final Map<String, WebhookEvent> byEventId = new ConcurrentHashMap<>();
    private final Map<String, WebhookEvent> byId = new ConcurrentHashMap<>();

    @Override
    public Optional<WebhookEvent> findByEventId(String eventId) {
        return Optional.ofNullable(byEventId.get(eventId));
    }

    @Override
    public WebhookEvent create(WebhookEvent event) {
        if (byEventId.putIfAbsent(event.getEventId(), event) != null) {
            throw new DataIntegrityViolationException("duplicate event_id " + event.getEventId());
        }
        byId.put(event.getId(), event);
        return event;
    }

    @Override
    public synchronized boolean claimForRetry(String id) {
        WebhookEvent row = byId.get(id);
        if (row == null || row.isProcessed() || row.getErrorMessage() == null) {
            return false;
        }
        row.setErrorMessage(null);
        return true;
    }

    @Override
    public synchronized void markProcessed(String id) {
        byId.get(id).markProcessed();
    }

    @Override
    public synchronized void markFailed(String id, String message) {
        byId.get(id).markFailed(message);
    }

    int size() {
        return byEventId.size();
    }
}
