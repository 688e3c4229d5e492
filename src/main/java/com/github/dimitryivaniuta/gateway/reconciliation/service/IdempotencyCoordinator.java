package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.github.dimitryivaniuta.gateway.reconciliation.domain.WebhookEvent;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.Admission;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.IncomingWebhook;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Decides whether a delivered webhook may run its side effect.
 *
 * <p>Decision table:
 * <ol>
 *   <li>No row: insert one. Insert wins =&gt; EXECUTE; unique violation with the twin's row visible =&gt; SKIP;
 *   any other integrity violation fails the delivery</li>
 *   <li>Row processed =&gt; SKIP</li>
 *   <li>Row carries an error =&gt; clear it and RETRY on the same row (only one racing caller clears it)</li>
 *   <li>Row neither processed nor failed =&gt; SKIP, another execution is in flight</li>
 * </ol>
 *
 * <p>An in-flight row whose execution crashed stays skipped; there is no lease. Providers retry only by
 * redelivering, and a redelivery only retries after {@link #fail} recorded an error.</p>
 */
@Service
public class IdempotencyCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyCoordinator.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final WebhookEventStore store;

    private final Counter executeCounter;
    private final Counter retryCounter;
    private final Counter skipCounter;

    /**
     * Creates the coordinator.
     *
     * @param store event store
     * @param meterRegistry metrics
     */
    public IdempotencyCoordinator(WebhookEventStore store, MeterRegistry meterRegistry) {
        this.store = store;
        this.executeCounter = Counter.builder("webhooks.admission.execute").register(meterRegistry);
        this.retryCounter = Counter.builder("webhooks.admission.retry").register(meterRegistry);
        this.skipCounter = Counter.builder("webhooks.admission.skip").register(meterRegistry);
    }

    /**
     * Admits a delivered event.
     *
     * @param incoming delivered event
     * @return admission
     * @throws WebhookProcessingException when the event cannot be recorded at all
     */
    public Admission admit(IncomingWebhook incoming) {
        Optional<WebhookEvent> existing = store.findByEventId(incoming.eventId());

        if (existing.isEmpty()) {
            return createOrSkip(incoming);
        }

        WebhookEvent row = existing.get();
        if (row.isProcessed()) {
            log.info("Webhook {} already processed, skipping", incoming.eventId());
            return skip(row);
        }

        if (row.hasError()) {
            if (store.claimForRetry(row.getId())) {
                log.info("Webhook {} retrying after previous failure: {}", incoming.eventId(), row.getErrorMessage());
                row.setErrorMessage(null);
                retryCounter.increment();
                return Admission.retry(row);
            }
            log.info("Webhook {} retry already claimed by a concurrent delivery, skipping", incoming.eventId());
            return skip(row);
        }

        log.info("Webhook {} in flight, skipping", incoming.eventId());
        return skip(row);
    }

    /**
     * Marks the admitted event as completed.
     *
     * @param rowId row id from the admission
     */
    public void complete(String rowId) {
        store.markProcessed(rowId);
    }

    /**
     * Records a failed execution so that the next redelivery retries.
     *
     * @param rowId row id from the admission
     * @param message failure description
     */
    public void fail(String rowId, String message) {
        store.markFailed(rowId, truncate(message));
    }

    private Admission createOrSkip(IncomingWebhook incoming) {
        WebhookEvent candidate = WebhookEvent.received(
                incoming.eventId(),
                incoming.provider(),
                incoming.eventType(),
                incoming.correlationId(),
                incoming.payloadJson()
        );
        try {
            WebhookEvent created = store.create(candidate);
            executeCounter.increment();
            log.info("Webhook {} admitted provider={} type={} correlation={}",
                    incoming.eventId(), incoming.provider(), incoming.eventType(), incoming.correlationId());
            return Admission.execute(created);
        } catch (DataIntegrityViolationException ex) {
            // a lost insert race leaves the twin's row behind; any other violation (over-long column, null) does not
            Optional<WebhookEvent> twin = store.findByEventId(incoming.eventId());
            if (twin.isPresent()) {
                log.info("Webhook {} inserted concurrently by another delivery, skipping", incoming.eventId());
                return skip(twin.get());
            }
            log.error("Webhook {} could not be recorded: {}", incoming.eventId(), ex.getMostSpecificCause().getMessage());
            throw new WebhookProcessingException("admission",
                    "Event could not be recorded: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    private Admission skip(WebhookEvent row) {
        skipCounter.increment();
        return Admission.skip(row);
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
