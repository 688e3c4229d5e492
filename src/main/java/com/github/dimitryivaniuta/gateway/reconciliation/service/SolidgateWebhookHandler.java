package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.reconciliation.alert.AlertNotifier;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.Admission;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.IncomingWebhook;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.SettlementReceipt;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.WebhookAck;
import com.github.dimitryivaniuta.gateway.reconciliation.service.events.WebhookSettledEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handles Solidgate order notifications.
 *
 * <p>Flow: admit the event, settle the cart when {@code order.status == settle_ok}, then complete the
 * row and enqueue a {@code WebhookSettled} event. A failure after admission (settlement or completion) is
 * recorded on the row, alerted, and rethrown so the provider gets a 5xx and redelivers.</p>
 */
@Service
public class SolidgateWebhookHandler {

    private static final Logger log = LoggerFactory.getLogger(SolidgateWebhookHandler.class);

    public static final String PROVIDER = "solidgate";

    static final String SETTLE_OK = "settle_ok";

    static final String STEP_COMPLETION = "completion";

    private static final String SETTLEMENT_FAILED_TITLE = "Settlement failed";

    private final IdempotencyCoordinator coordinator;
    private final SettlementService settlementService;
    private final ReconciliationEventWriter eventWriter;
    private final AlertNotifier alertNotifier;

    private final Counter settlementFailedCounter;

    /**
     * Creates the handler.
     *
     * @param coordinator idempotency coordinator
     * @param settlementService settlement flow
     * @param eventWriter completion and outbox writer
     * @param alertNotifier operator alerts
     * @param meterRegistry metrics
     */
    public SolidgateWebhookHandler(
            IdempotencyCoordinator coordinator,
            SettlementService settlementService,
            ReconciliationEventWriter eventWriter,
            AlertNotifier alertNotifier,
            MeterRegistry meterRegistry
    ) {
        this.coordinator = coordinator;
        this.settlementService = settlementService;
        this.eventWriter = eventWriter;
        this.alertNotifier = alertNotifier;
        this.settlementFailedCounter = Counter.builder("webhooks.settlement.failed").register(meterRegistry);
    }

    /**
     * Processes one delivery.
     *
     * @param eventId value of the {@code solidgate-event-id} header
     * @param eventType value of the {@code solidgate-event-type} header
     * @param payload parsed body
     * @param rawPayload body as received
     * @return acknowledgment
     * @throws WebhookProcessingException when settlement or completion failed
     */
    public WebhookAck handle(String eventId, String eventType, JsonNode payload, String rawPayload) {
        JsonNode order = payload.path("order");
        String cartId = textOrNull(order.path("order_id"));
        String orderStatus = textOrNull(order.path("status"));

        Admission admission = coordinator.admit(new IncomingWebhook(eventId, PROVIDER, eventType, cartId, rawPayload));
        if (!admission.shouldRun()) {
            return WebhookAck.alreadyProcessed();
        }

        if (!SETTLE_OK.equals(orderStatus)) {
            try {
                coordinator.complete(admission.rowId());
            } catch (RuntimeException ex) {
                throw recordFailure(admission, cartId, completionFailure(ex), "Webhook not recorded");
            }
            log.info("Solidgate event {} acknowledged without settlement, order status={}", eventId, orderStatus);
            return WebhookAck.ok("Webhook processed", payload);
        }

        SettlementReceipt receipt;
        try {
            receipt = settlementService.settle(cartId);
        } catch (WebhookProcessingException ex) {
            throw recordFailure(admission, cartId, ex, SETTLEMENT_FAILED_TITLE);
        } catch (RuntimeException ex) {
            throw recordFailure(admission, cartId, new WebhookProcessingException("settlement", String.valueOf(ex.getMessage()), ex),
                    SETTLEMENT_FAILED_TITLE);
        }

        try {
            eventWriter.completeWithEvent(admission, "WebhookSettled", cartId, new WebhookSettledEvent(
                    "1",
                    UUID.randomUUID().toString(),
                    Instant.now(),
                    PROVIDER,
                    eventId,
                    cartId,
                    receipt.paymentSessionId(),
                    receipt.paymentId(),
                    receipt.currencyCode()
            ));
        } catch (RuntimeException ex) {
            // the cart is settled but the row is not; leaving it in flight would skip every redelivery
            throw recordFailure(admission, cartId, completionFailure(ex), "Settlement not recorded");
        }
        return WebhookAck.ok(cartId + " successfully settled", null);
    }

    /**
     * Records the failure on the row and alerts operators. Neither step may replace the original error.
     */
    private WebhookProcessingException recordFailure(Admission admission, String cartId, WebhookProcessingException ex, String title) {
        settlementFailedCounter.increment();
        log.error("Solidgate webhook failed for cart {} at step {}: {}", cartId, ex.getStep(), ex.getMessage());

        try {
            coordinator.fail(admission.rowId(), ex.describe());
        } catch (RuntimeException recordEx) {
            ex.addSuppressed(recordEx);
            log.error("Could not record failure on webhook row {}: {}", admission.rowId(), recordEx.getMessage());
        }

        try {
            alertNotifier.sendCriticalAlert(
                    title,
                    "*Cart:* `" + cartId + "`\n*Step:* " + ex.getStep() + "\n*Error:* " + ex.getMessage(),
                    "Solidgate"
            );
        } catch (RuntimeException alertEx) {
            ex.addSuppressed(alertEx);
            log.error("Could not send settlement alert: {}", alertEx.getMessage());
        }
        return ex;
    }

    private static WebhookProcessingException completionFailure(RuntimeException ex) {
        return new WebhookProcessingException(STEP_COMPLETION, String.valueOf(ex.getMessage()), ex);
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
