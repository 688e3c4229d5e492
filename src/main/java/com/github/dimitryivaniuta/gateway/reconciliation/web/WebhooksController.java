package com.github.dimitryivaniuta.gateway.reconciliation.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.service.SolidgateWebhookHandler;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.WebhookAck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Provider webhook endpoints.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhooksController {

    private static final Logger log = LoggerFactory.getLogger(WebhooksController.class);

    public static final String SOLIDGATE_EVENT_ID_HEADER = "solidgate-event-id";
    public static final String SOLIDGATE_EVENT_TYPE_HEADER = "solidgate-event-type";

    private final SolidgateWebhookHandler solidgateHandler;
    private final ObjectMapper objectMapper;

    /**
     * Creates the controller.
     *
     * @param solidgateHandler Solidgate handler
     * @param objectMapper JSON mapper
     */
    public WebhooksController(SolidgateWebhookHandler solidgateHandler, ObjectMapper objectMapper) {
        this.solidgateHandler = solidgateHandler;
        this.objectMapper = objectMapper;
    }

    /**
     * Solidgate order notification. Settles the cart when the order status is {@code settle_ok}.
     *
     * @param eventId event id header
     * @param eventType event type header
     * @param body raw JSON body
     * @return acknowledgment
     */
    @PostMapping(value = "/solidgate", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookAck> solidgate(
            @RequestHeader(value = SOLIDGATE_EVENT_ID_HEADER, required = false) String eventId,
            @RequestHeader(value = SOLIDGATE_EVENT_TYPE_HEADER, required = false) String eventType,
            @RequestBody String body
    ) {
        if (eventId == null || eventId.isBlank()) {
            throw JsonBodies.badRequest("Missing " + SOLIDGATE_EVENT_ID_HEADER + " header");
        }
        JsonNode payload = JsonBodies.parseObject(objectMapper, body);
        return ResponseEntity.ok(solidgateHandler.handle(eventId.trim(), eventType, payload, body));
    }

    /**
     * OrderGroove notification; acknowledged and echoed.
     *
     * @param body raw JSON body
     * @return acknowledgment
     */
    @PostMapping(value = "/ordergroove", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookAck> ordergroove(@RequestBody String body) {
        JsonNode payload = JsonBodies.parseObject(objectMapper, body);
        log.info("OrderGroove webhook received, fields={}", payload.size());
        return ResponseEntity.ok(WebhookAck.ok("Webhook processed", payload));
    }
}
