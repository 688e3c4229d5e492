package com.github.dimitryivaniuta.gateway.reconciliation.service.dto;

/**
 * Provider notification as seen by the idempotency layer.
 *
 * @param eventId provider-scoped event id
 * @param provider provider name
 * @param eventType provider event type
 * @param correlationId order or cart id, may be null
 * @param payloadJson raw payload JSON
 */
public record IncomingWebhook(String eventId, String provider, String eventType, String correlationId, String payloadJson) {}
