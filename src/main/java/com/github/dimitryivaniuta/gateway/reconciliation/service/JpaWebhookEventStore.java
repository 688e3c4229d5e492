package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.github.dimitryivaniuta.gateway.reconciliation.domain.WebhookEvent;
import com.github.dimitryivaniuta.gateway.reconciliation.repo.WebhookEventRepository;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres-backed {@link WebhookEventStore}.
 */
@Component
public class JpaWebhookEventStore implements WebhookEventStore {

    private final WebhookEventRepository repository;

    /**
     * Creates the store.
     *
     * @param repository webhook event repository
     */
    public JpaWebhookEventStore(WebhookEventRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WebhookEvent> findByEventId(String eventId) {
        return repository.findByEventId(eventId);
    }

    /**
     * Inserts in its own transaction and flushes, so the unique constraint fires here and not at some
     * later commit of the caller.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WebhookEvent create(WebhookEvent event) {
        return repository.saveAndFlush(event);
    }

    @Override
    @Transactional
    public boolean claimForRetry(String id) {
        return repository.claimForRetry(id, Instant.now()) == 1;
    }

    @Override
    @Transactional
    public void markProcessed(String id) {
        WebhookEvent e = repository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Webhook event not found: " + id));
        e.markProcessed();
        repository.save(e);
    }

    @Override
    @Transactional
    public void markFailed(String id, String message) {
        WebhookEvent e = repository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Webhook event not found: " + id));
        e.markFailed(message);
        repository.save(e);
    }
}
