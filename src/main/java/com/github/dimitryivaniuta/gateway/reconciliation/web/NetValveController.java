package com.github.dimitryivaniuta.gateway.reconciliation.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.AuthorizationOrchestrator;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.AuthorizationResult;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.CheckoutSessionData;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.FundsMovementResult;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.FundsOrchestrator;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.HpfSessionOrchestrator;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.WebhookClassification;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.SessionOutcome;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.SessionRequest;
import com.github.dimitryivaniuta.gateway.reconciliation.service.NetValveWebhookHandler;
import com.github.dimitryivaniuta.gateway.reconciliation.web.dto.CancelRequest;
import com.github.dimitryivaniuta.gateway.reconciliation.web.dto.CaptureRequest;
import com.github.dimitryivaniuta.gateway.reconciliation.web.dto.PaymentStatusResponse;
import com.github.dimitryivaniuta.gateway.reconciliation.web.dto.RefundRequest;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * NetValve card gateway endpoints used by the storefront and by NetValve itself.
 */
@RestController
@RequestMapping(value = "/api/v1/netvalve", produces = MediaType.APPLICATION_JSON_VALUE)
public class NetValveController {

    private final HpfSessionOrchestrator sessionOrchestrator;
    private final AuthorizationOrchestrator authorizationOrchestrator;
    private final FundsOrchestrator fundsOrchestrator;
    private final NetValveWebhookHandler webhookHandler;
    private final ObjectMapper objectMapper;

    /**
     * Creates the controller.
     *
     * @param sessionOrchestrator session waterfall
     * @param authorizationOrchestrator authorization paths
     * @param fundsOrchestrator capture, refund, cancel
     * @param webhookHandler gateway webhook handler
     * @param objectMapper JSON mapper
     */
    public NetValveController(
            HpfSessionOrchestrator sessionOrchestrator,
            AuthorizationOrchestrator authorizationOrchestrator,
            FundsOrchestrator fundsOrchestrator,
            NetValveWebhookHandler webhookHandler,
            ObjectMapper objectMapper
    ) {
        this.sessionOrchestrator = sessionOrchestrator;
        this.authorizationOrchestrator = authorizationOrchestrator;
        this.fundsOrchestrator = fundsOrchestrator;
        this.webhookHandler = webhookHandler;
        this.objectMapper = objectMapper;
    }

    /**
     * Initializes a card-entry session. 200 with {@code flow=hpf|hpp}, 502 when every step failed.
     *
     * @param request session request, may be absent
     * @return session or failure
     */
    @PostMapping("/hpf/session")
    public ResponseEntity<Object> createSession(@RequestBody(required = false) SessionRequest request) {
        return toResponse(sessionOrchestrator.initialize(
                request == null ? SessionRequest.of(null, null, null) : request));
    }

    /**
     * Query-parameter variant of {@link #createSession}.
     *
     * @param version script version
     * @param currencyCode currency
     * @param amount amount
     * @param cartId cart id
     * @return session or failure
     */
    @GetMapping("/hpf/session")
    public ResponseEntity<Object> getSession(
            @RequestParam(value = "version", required = false) String version,
            @RequestParam(value = "currency_code", required = false) String currencyCode,
            @RequestParam(value = "amount", required = false) BigDecimal amount,
            @RequestParam(value = "cart_id", required = false) String cartId
    ) {
        return toResponse(sessionOrchestrator.initialize(
                new SessionRequest(version, currencyCode, amount, cartId, null, null, null, null, null)));
    }

    /**
     * Authorizes a checkout payment session.
     *
     * @param body payment session data
     * @return status and annotated session data
     */
    @PostMapping(value = "/payment", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AuthorizationResult> authorize(@RequestBody JsonNode body) {
        if (!body.isObject()) {
            throw JsonBodies.badRequest("Request body must be a JSON object");
        }
        return ResponseEntity.ok(authorizationOrchestrator.authorize(CheckoutSessionData.from(body)));
    }

    @PostMapping(value = "/capture", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FundsMovementResult> capture(@Valid @RequestBody CaptureRequest request) {
        return ResponseEntity.ok(fundsOrchestrator.capture(request.transactionId(), request.amount(), request.alreadyCaptured()));
    }

    @PostMapping(value = "/refund", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FundsMovementResult> refund(@Valid @RequestBody RefundRequest request) {
        return ResponseEntity.ok(fundsOrchestrator.refund(request.transactionId(), request.amount()));
    }

    @PostMapping(value = "/cancel", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FundsMovementResult> cancel(@Valid @RequestBody CancelRequest request) {
        return ResponseEntity.ok(fundsOrchestrator.cancel(request.transactionId()));
    }

    /**
     * NetValve webhook receiver.
     *
     * @param body raw JSON body
     * @return mapped action
     */
    @PostMapping("/webhook")
    public ResponseEntity<WebhookClassification> webhook(@RequestBody String body) {
        JsonNode payload = JsonBodies.parseObject(objectMapper, body);
        return ResponseEntity.ok(webhookHandler.handle(payload, body));
    }

    /**
     * Echoes a persisted session status, normalized to a known value.
     *
     * @param status session status
     * @param transactionId transaction id
     * @return normalized status
     */
    @GetMapping("/status")
    public ResponseEntity<PaymentStatusResponse> status(
            @RequestParam(value = "status", defaultValue = "pending") String status,
            @RequestParam(value = "transaction_id", required = false) String transactionId
    ) {
        return ResponseEntity.ok(PaymentStatusResponse.normalized(status, transactionId));
    }

    private static ResponseEntity<Object> toResponse(SessionOutcome outcome) {
        return ResponseEntity.status(outcome.httpStatus()).body(outcome.body());
    }
}
