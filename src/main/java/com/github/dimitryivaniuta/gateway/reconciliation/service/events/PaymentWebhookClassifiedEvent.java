package com.github.dimitryivaniuta.gateway.reconciliation.service.events;

import java.time.Instant;

/**
 * Emitted for every admitted gateway webhook with the payment action it maps to.
 */
public record PaymentWebhookClassifiedEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String provider,
        String providerEventId,
        String eventType,
        String action,
        String sessionId,
        String amount
) {}
