package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Chooses how to authorize a checkout session, in this order:
 * <ol>
 *   <li>no proof at all: ask for card input</li>
 *   <li>sale already succeeded: authorized, no gateway call</li>
 *   <li>hosted fields completed: CARD sale</li>
 *   <li>stored token different from the hosted-fields token: TOKEN sale</li>
 *   <li>transaction or order id from a redirect or webhook: authorized locally</li>
 *   <li>otherwise: unverified, never authorized</li>
 * </ol>
 */
@Service
public class AuthorizationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationOrchestrator.class);

    static final String CARD_REQUIRED_MESSAGE = "NetValve payment requires card details before authorizing the order.";
    static final String UNVERIFIED_MESSAGE = "Payment declined: unable to verify payment with NetValve. Please try a different card.";

    private final SaleService saleService;
    private final Clock clock;

    /**
     * Creates the orchestrator.
     *
     * @param saleService sale execution
     * @param clock clock for timestamps and generated ids
     */
    public AuthorizationOrchestrator(SaleService saleService, Clock clock) {
        this.saleService = saleService;
        this.clock = clock;
    }

    /**
     * @param data checkout session
     * @return result, never throws for gateway failures
     */
    public AuthorizationResult authorize(CheckoutSessionData data) {
        if (!data.hasPaymentConfirmation()) {
            ObjectNode out = base(data, AuthorizationOutcome.REQUIRES_INPUT);
            out.put("requires_payment_input", true);
            out.put("payment_type", "card");
            out.put("message", CARD_REQUIRED_MESSAGE);
            return new AuthorizationResult(AuthorizationOutcome.REQUIRES_INPUT, out);
        }

        if (data.saleAlreadySucceeded()) {
            log.info("NetValve authorize: sale already succeeded (txn={}), returning authorized",
                    data.rawString("netvalve_transaction_id"));
            ObjectNode out = base(data, AuthorizationOutcome.AUTHORIZED);
            out.put("requires_payment_input", false);
            String previous = data.pickString("authorized_at");
            out.put("authorized_at", previous.isEmpty() ? now() : previous);
            return new AuthorizationResult(AuthorizationOutcome.AUTHORIZED, out);
        }

        if (data.hpfCompleted()) {
            log.info("NetValve authorize: hosted fields completed, running CARD sale");
            return fromSale(data, saleService.process(data, PaymentType.CARD), "hpf");
        }

        if (data.hasStoredTokenDistinctFromSession()) {
            log.info("NetValve authorize: stored card token, running TOKEN sale");
            return fromSale(data, saleService.process(data, PaymentType.TOKEN), null);
        }

        if (!data.hasExternalProof()) {
            log.warn("NetValve authorize: refusing local authorization without transaction proof");
            ObjectNode out = base(data, AuthorizationOutcome.UNVERIFIED);
            out.put("requires_payment_input", true);
            out.put("netvalve_sale_attempted", false);
            out.put("netvalve_sale_success", false);
            out.put("error_message", UNVERIFIED_MESSAGE);
            return new AuthorizationResult(AuthorizationOutcome.UNVERIFIED, out);
        }

        log.info("NetValve authorize: external transaction proof, authorizing locally");
        ObjectNode out = base(data, AuthorizationOutcome.AUTHORIZED);
        out.put("requires_payment_input", false);
        out.put("authorized_at", now());
        return new AuthorizationResult(AuthorizationOutcome.AUTHORIZED, out);
    }

    private AuthorizationResult fromSale(CheckoutSessionData data, SaleResult sale, String paymentFlow) {
        AuthorizationOutcome outcome = sale.success() ? AuthorizationOutcome.AUTHORIZED : AuthorizationOutcome.DECLINED;
        ObjectNode out = base(data, outcome);
        out.put("netvalve_sale_attempted", true);
        out.put("netvalve_sale_success", sale.success());
        if (sale.success()) {
            out.put("requires_payment_input", false);
            out.put("authorized_at", now());
            out.put("netvalve_transaction_id", sale.transactionId());
            out.put("netvalve_order_id", sale.orderId());
            out.put("netvalve_response_code", sale.responseCode());
            out.put("netvalve_response_message", sale.responseMessage());
        } else {
            out.put("requires_payment_input", true);
            out.put("netvalve_response_code", sale.responseCode());
            out.put("netvalve_response_message", sale.responseMessage());
            out.put("netvalve_bank_response_code", sale.bankResponseCode());
            out.put("netvalve_decline_reason", sale.declineReason());
            out.put("error_message", "Payment declined" + sale.declineDetail() + ". Please try a different card.");
            log.info("NetValve authorize: sale declined code={} bank={} reason={}",
                    sale.responseCode(), sale.bankResponseCode(), sale.declineReason());
        }

        echoRequestFields(out, sale);
        if (sale.gatewayErrors() != null && !sale.gatewayErrors().isEmpty()) {
            out.set("errors", sale.gatewayErrors());
        }
        putIfText(out, "card_number", sale.cardNumber());
        putIfText(out, "card_type", sale.cardType());
        putIfText(out, "card_expiry", sale.cardExpiry());
        putIfText(out, "card_holder_name", sale.cardHolderName());
        if (paymentFlow != null) {
            out.put("payment_flow", paymentFlow);
        }
        return new AuthorizationResult(outcome, out);
    }

    private ObjectNode base(CheckoutSessionData data, AuthorizationOutcome outcome) {
        ObjectNode out = data.copy();
        out.put("id", data.idOr("netvalve_" + clock.instant().getEpochSecond()));
        out.put("status", outcome.status());
        return out;
    }

    private static void echoRequestFields(ObjectNode out, SaleResult sale) {
        putIfNotNull(out, "client_order_id", sale.clientOrderId());
        putIfNotNull(out, "payment_token", sale.paymentToken());
        putIfNotNull(out, "site_id", sale.siteId());
        putIfNotNull(out, "mid_id", sale.midId());
        if (sale.amount() != null) {
            out.put("amount", sale.amount());
        }
        putIfNotNull(out, "currency", sale.currency());
    }

    private static void putIfNotNull(ObjectNode out, String key, String value) {
        if (value != null) {
            out.put(key, value);
        }
    }

    private static void putIfText(ObjectNode out, String key, String value) {
        if (value != null && !value.isEmpty()) {
            out.put(key, value);
        }
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
