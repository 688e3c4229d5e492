package com.github.dimitryivaniuta.gateway.reconciliation.service.events;

import java.time.Instant;

/**
 * Emitted when a provider settlement notification captured the cart payment on the fulfillment backend.
 */
public record WebhookSettledEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String provider,
        String providerEventId,
        String cartId,
        String paymentSessionId,
        String paymentId,
        String currencyCode
) {}
