package com.github.dimitryivaniuta.gateway.reconciliation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One inbound provider notification, keyed by the provider's own event id.
 *
 * <p>State is carried by two columns:
 * <ul>
 *   <li>{@code processed=true}: the side effect completed, redeliveries are skipped</li>
 *   <li>{@code error_message} set: the last execution failed, the next redelivery retries</li>
 *   <li>neither: an execution is in flight</li>
 * </ul>
 *
 * <p>The unique constraint on {@code event_id} is what makes concurrent first deliveries safe: exactly
 * one insert wins, the others fail with a constraint violation. Rows are never deleted.</p>
 */
@Entity
@Table(
        name = "webhook_events",
        uniqueConstraints = @UniqueConstraint(name = "uq_webhook_events_event_id", columnNames = "event_id"),
        indexes = @Index(name = "idx_webhook_events_correlation_id", columnList = "correlation_id")
)
@Getter
@Setter
@NoArgsConstructor
public class WebhookEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "event_id", nullable = false, updatable = false, length = 255)
    private String eventId;

    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    @Column(name = "event_type", nullable = true, length = 128)
    private String eventType;

    @Column(name = "correlation_id", nullable = true, length = 255)
    private String correlationId;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "error_message", nullable = true, columnDefinition = "text")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates an unprocessed event row.
     *
     * @param eventId provider event id
     * @param provider provider name
     * @param eventType provider event type
     * @param correlationId order or cart id, may be null
     * @param payload raw payload JSON
     * @return event
     */
    public static WebhookEvent received(String eventId, String provider, String eventType, String correlationId, String payload) {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(provider, "provider");

        WebhookEvent e = new WebhookEvent();
        e.id = UUID.randomUUID().toString();
        e.eventId = eventId;
        e.provider = provider;
        e.eventType = eventType;
        e.correlationId = correlationId;
        e.payload = payload == null ? "{}" : payload;
        e.processed = false;
        e.createdAt = Instant.now();
        e.updatedAt = e.createdAt;
        return e;
    }

    /**
     * Marks the side effect as completed.
     */
    public void markProcessed() {
        this.processed = true;
        this.errorMessage = null;
        this.updatedAt = Instant.now();
    }

    /**
     * Records a failed execution; the row becomes eligible for retry.
     *
     * @param message human readable cause
     */
    public void markFailed(String message) {
        this.processed = false;
        this.errorMessage = message == null || message.isBlank() ? "unknown error" : message;
        this.updatedAt = Instant.now();
    }

    /**
     * True when a prior execution failed and has not been retried yet.
     *
     * @return retryable
     */
    public boolean hasError() {
        return errorMessage != null;
    }

    /**
     * True when no execution has finished yet.
     *
     * @return in flight
     */
    public boolean isInFlight() {
        return !processed && errorMessage == null;
    }
}
