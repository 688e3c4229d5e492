package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.reconciliation.alert.AlertNotifier;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.WebhookClassification;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.WebhookEventClassifier;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.Admission;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.IncomingWebhook;
import com.github.dimitryivaniuta.gateway.reconciliation.service.events.PaymentWebhookClassifiedEvent;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handles NetValve webhooks: classifies the event and, when it can be identified, records it once and
 * publishes a {@code PaymentWebhookClassified} event.
 *
 * <p>NetValve sends no event id header. The id is {@code netvalve_<id>_<type>}, where {@code id} is
 * the first of {@code id}, {@code session_id}, {@code transaction_id}.</p>
 */
@Service
public class NetValveWebhookHandler {

    private static final Logger log = LoggerFactory.getLogger(NetValveWebhookHandler.class);

    public static final String PROVIDER = "netvalve";

    private final WebhookEventClassifier classifier;
    private final IdempotencyCoordinator coordinator;
    private final ReconciliationEventWriter eventWriter;
    private final AlertNotifier alertNotifier;

    /**
     * Creates the handler.
     *
     * @param classifier event classifier
     * @param coordinator idempotency coordinator
     * @param eventWriter completion and outbox writer
     * @param alertNotifier operator alerts
     */
    public NetValveWebhookHandler(
            WebhookEventClassifier classifier,
            IdempotencyCoordinator coordinator,
            ReconciliationEventWriter eventWriter,
            AlertNotifier alertNotifier
    ) {
        this.classifier = classifier;
        this.coordinator = coordinator;
        this.eventWriter = eventWriter;
        this.alertNotifier = alertNotifier;
    }

    /**
     * @param payload parsed body
     * @param rawPayload body as received
     * @return classification, also for redeliveries
     * @throws WebhookProcessingException when the admitted event could not be completed
     */
    public WebhookClassification handle(JsonNode payload, String rawPayload) {
        String type = text(payload, "type");
        WebhookClassification classification = classifier.classify(payload);
        log.info("NetValve webhook type={} action={}", type, classification.action());

        String eventId = eventId(payload, type);
        if (eventId == null) {
            log.warn("NetValve webhook without id or type, not recorded");
            return classification;
        }

        String sessionId = classification.data() != null ? classification.data().sessionId() : null;
        Admission admission = coordinator.admit(new IncomingWebhook(
                eventId, PROVIDER, type, firstNonNull(text(payload, "order_id"), sessionId), rawPayload));
        if (!admission.shouldRun()) {
            return classification;
        }

        try {
            eventWriter.completeWithEvent(admission, "PaymentWebhookClassified", sessionId, new PaymentWebhookClassifiedEvent(
                    "1",
                    UUID.randomUUID().toString(),
                    Instant.now(),
                    PROVIDER,
                    eventId,
                    type,
                    classification.action().name(),
                    sessionId,
                    classification.data() != null ? String.valueOf(classification.data().amount()) : null
            ));
        } catch (RuntimeException ex) {
            throw recordFailure(admission, eventId, ex);
        }
        return classification;
    }

    /**
     * Marks the row failed so the next redelivery retries, and alerts. Neither step may replace the original error.
     */
    private WebhookProcessingException recordFailure(Admission admission, String eventId, RuntimeException cause) {
        WebhookProcessingException ex = new WebhookProcessingException("completion", String.valueOf(cause.getMessage()), cause);
        log.error("NetValve webhook {} could not be completed: {}", eventId, ex.getMessage());

        try {
            coordinator.fail(admission.rowId(), ex.describe());
        } catch (RuntimeException recordEx) {
            ex.addSuppressed(recordEx);
            log.error("Could not record failure on webhook row {}: {}", admission.rowId(), recordEx.getMessage());
        }

        try {
            alertNotifier.sendCriticalAlert(
                    "Gateway webhook not recorded",
                    "*Event:* `" + eventId + "`\n*Step:* " + ex.getStep() + "\n*Error:* " + ex.getMessage(),
                    "NetValve"
            );
        } catch (RuntimeException alertEx) {
            ex.addSuppressed(alertEx);
            log.error("Could not send gateway webhook alert: {}", alertEx.getMessage());
        }
        return ex;
    }

    static String eventId(JsonNode payload, String type) {
        String id = firstNonNull(text(payload, "id"), firstNonNull(text(payload, "session_id"), text(payload, "transaction_id")));
        if (id == null || type == null) {
            return null;
        }
        return "netvalve_" + id + "_" + type.toLowerCase(Locale.ROOT);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isValueNode() && !v.isNull() && !v.asText().isEmpty() ? v.asText() : null;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
