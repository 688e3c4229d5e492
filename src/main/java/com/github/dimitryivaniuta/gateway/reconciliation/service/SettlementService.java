package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.reconciliation.config.AppProperties;
import com.github.dimitryivaniuta.gateway.reconciliation.fulfillment.BackendRequest;
import com.github.dimitryivaniuta.gateway.reconciliation.fulfillment.BackendResponse;
import com.github.dimitryivaniuta.gateway.reconciliation.fulfillment.FulfillmentBackendClient;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.SettlementReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Captures the payment of a cart on the fulfillment backend.
 *
 * <p>Three calls, each a labelled step:
 * <ol>
 *   <li>{@code cart_lookup}: {@code GET /store/carts/{id}?fields=+payment_collection}, first payment session</li>
 *   <li>{@code payment_lookup}: {@code GET /admin/payments?payment_session_id=...}, first payment</li>
 *   <li>{@code capture}: {@code POST /admin/payments/{id}/capture}</li>
 * </ol>
 */
@Service
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private record PaymentSessionRef(JsonNode session, String collectionId) {}

    public static final String STEP_CART_LOOKUP = "cart_lookup";
    public static final String STEP_PAYMENT_LOOKUP = "payment_lookup";
    public static final String STEP_CAPTURE = "capture";

    private final FulfillmentBackendClient backend;
    private final AppProperties properties;

    /**
     * Creates the service.
     *
     * @param backend fulfillment backend client
     * @param properties application properties
     */
    public SettlementService(FulfillmentBackendClient backend, AppProperties properties) {
        this.backend = backend;
        this.properties = properties;
    }

    /**
     * Settles a cart.
     *
     * @param cartId cart id
     * @return receipt
     * @throws WebhookProcessingException when any step fails
     */
    public SettlementReceipt settle(String cartId) {
        if (cartId == null || cartId.isBlank()) {
            throw new WebhookProcessingException(STEP_CART_LOOKUP, "Missing cart id");
        }

        PaymentSessionRef session = findPaymentSession(cartId);
        String sessionId = session.session().path("id").asText("");
        String paymentId = findPaymentId(sessionId);
        JsonNode payment = capture(paymentId);

        log.info("Cart {} settled: session={} payment={}", cartId, sessionId, paymentId);
        return new SettlementReceipt(
                cartId,
                sessionId,
                session.collectionId(),
                paymentId,
                session.session().get("amount"),
                session.session().path("currency_code").asText(null),
                payment
        );
    }

    private PaymentSessionRef findPaymentSession(String cartId) {
        String publishableKey = properties.getFulfillment().getPublishableKey();
        BackendResponse resp = backend.execute(
                BackendRequest.get("/store/carts/{cartId}")
                        .withPathVariable("cartId", cartId)
                        .withParam("fields", "+payment_collection")
                        .withHeader(HttpHeaders.AUTHORIZATION, "Bearer " + publishableKey)
                        .withPublishableKey()
        );
        if (!resp.success()) {
            throw new WebhookProcessingException(STEP_CART_LOOKUP,
                    "Cart lookup failed for " + cartId + ": HTTP " + resp.statusCode() + " " + resp.message());
        }

        JsonNode collection = resp.field("cart").path("payment_collection");
        JsonNode sessions = collection.path("payment_sessions");
        if (!sessions.isArray() || sessions.isEmpty()) {
            throw new WebhookProcessingException(STEP_CART_LOOKUP, "No payment session found for cart " + cartId);
        }

        return new PaymentSessionRef(sessions.get(0), collection.path("id").asText(null));
    }

    private String findPaymentId(String paymentSessionId) {
        if (paymentSessionId.isBlank()) {
            throw new WebhookProcessingException(STEP_PAYMENT_LOOKUP, "Payment session has no id");
        }
        BackendResponse resp = backend.execute(
                BackendRequest.get("/admin/payments").withParam("payment_session_id", paymentSessionId)
        );
        if (!resp.success()) {
            throw new WebhookProcessingException(STEP_PAYMENT_LOOKUP,
                    "Payment lookup failed for session " + paymentSessionId + ": HTTP " + resp.statusCode());
        }
        JsonNode payments = resp.field("payments");
        String id = payments.isArray() && !payments.isEmpty() ? payments.get(0).path("id").asText("") : "";
        if (id.isBlank()) {
            throw new WebhookProcessingException(STEP_PAYMENT_LOOKUP, "No payment found for session " + paymentSessionId);
        }
        return id;
    }

    private JsonNode capture(String paymentId) {
        BackendResponse resp = backend.execute(
                BackendRequest.post("/admin/payments/{paymentId}/capture", null).withPathVariable("paymentId", paymentId));
        if (!resp.success()) {
            throw new WebhookProcessingException(STEP_CAPTURE,
                    "Capture failed for payment " + paymentId + ": HTTP " + resp.statusCode());
        }
        JsonNode payment = resp.field("payment");
        if (payment.isMissingNode() || payment.isNull()) {
            throw new WebhookProcessingException(STEP_CAPTURE, "Capture response of payment " + paymentId + " has no payment");
        }
        return payment;
    }
}
