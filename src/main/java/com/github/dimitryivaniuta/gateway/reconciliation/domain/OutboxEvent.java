package com.github.dimitryivaniuta.gateway.reconciliation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Reconciliation event waiting to be published to Kafka.
 *
 * <p>Written after a webhook has been settled or classified; the {@code OutboxDispatcher} publishes it
 * with retries so downstream consumers see every reconciled event at least once.</p>
 */
@Entity
@Table(
        name = "outbox_events",
        indexes = {
                @Index(name = "idx_outbox_status_next_created", columnList = "status,next_attempt_at,created_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    /** Provider that sent the source webhook, e.g. {@code solidgate}. */
    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    /** Id of the {@link WebhookEvent} row this event was derived from. */
    @Column(name = "webhook_event_id", nullable = false, length = 36)
    private String webhookEventId;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    /** Kafka key; the order or cart id when known. */
    @Column(name = "event_key", nullable = false, length = 255)
    private String eventKey;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OutboxStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at", nullable = true)
    private Instant nextAttemptAt;

    @Column(name = "last_error", nullable = true, columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "sent_at", nullable = true)
    private Instant sentAt;

    /**
     * Creates a pending event.
     *
     * @param provider source provider
     * @param webhookEventId source webhook row id
     * @param eventType event type
     * @param eventKey kafka key
     * @param payload JSON payload
     * @return event
     */
    public static OutboxEvent pending(String provider, String webhookEventId, String eventType, String eventKey, String payload) {
        OutboxEvent e = new OutboxEvent();
        e.id = UUID.randomUUID().toString();
        e.provider = provider;
        e.webhookEventId = webhookEventId;
        e.eventType = eventType;
        e.eventKey = eventKey;
        e.payload = payload;
        e.status = OutboxStatus.NEW;
        e.attemptCount = 0;
        e.createdAt = Instant.now();
        e.updatedAt = e.createdAt;
        return e;
    }

    /**
     * Marks the event as acknowledged by the broker.
     */
    public void markSent() {
        this.status = OutboxStatus.SENT;
        this.sentAt = Instant.now();
        this.updatedAt = this.sentAt;
        this.nextAttemptAt = null;
        this.lastError = null;
    }

    /**
     * Schedules another publish attempt.
     *
     * @param error error string
     * @param backoff delay before the next attempt
     */
    public void markRetry(String error, Duration backoff) {
        Instant now = Instant.now();
        this.status = OutboxStatus.RETRY;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = now.plus(backoff);
        this.updatedAt = now;
    }

    /**
     * Stops publishing this event.
     *
     * @param error last error string
     */
    public void markDead(String error) {
        this.status = OutboxStatus.DEAD;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = null;
        this.updatedAt = Instant.now();
    }
}
