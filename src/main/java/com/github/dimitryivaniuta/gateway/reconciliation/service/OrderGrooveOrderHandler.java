package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.Admission;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.IncomingWebhook;
import java.io.IOException;
import java.io.StringReader;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

/**
 * Handles OrderGroove recurring order placement requests.
 *
 * <p>The order XML is converted to a JSON tree wrapped in its root element name and persisted through
 * the {@link IdempotencyCoordinator}. OrderGroove expects an XML envelope back: SUCCESS with the order
 * id, or ERROR 020 when the XML cannot be parsed. A redelivered order is acknowledged with SUCCESS
 * again.</p>
 */
@Service
public class OrderGrooveOrderHandler {

    private static final Logger log = LoggerFactory.getLogger(OrderGrooveOrderHandler.class);

    public static final String PROVIDER = "ordergroove";
    public static final String EVENT_TYPE = "recurring_order_placement";

    static final String INVALID_XML_CODE = "020";
    static final String INVALID_XML_MESSAGE = "Invalid XML received";

    private final IdempotencyCoordinator coordinator;
    private final XmlMapper xmlMapper;
    private final ObjectMapper objectMapper;

    /**
     * Envelope returned to OrderGroove.
     *
     * @param httpStatus HTTP status
     * @param xml response document
     */
    public record OrderPlacementReply(int httpStatus, String xml) {}

    /**
     * Creates the handler.
     *
     * @param coordinator idempotency coordinator
     * @param xmlMapper XML reader
     * @param objectMapper JSON writer
     */
    public OrderGrooveOrderHandler(IdempotencyCoordinator coordinator, XmlMapper xmlMapper, ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.xmlMapper = xmlMapper;
        this.objectMapper = objectMapper;
    }

    /**
     * Processes one order placement.
     *
     * @param xml order document
     * @return reply envelope
     * @throws WebhookProcessingException when the admitted order could not be recorded
     */
    public OrderPlacementReply handle(String xml) {
        ObjectNode payload;
        try {
            payload = parseOrderXml(xml);
        } catch (IOException | XMLStreamException | RuntimeException ex) {
            log.error("Failed to parse OrderGroove XML: {}", ex.getMessage());
            return new OrderPlacementReply(400, errorXml(INVALID_XML_CODE, INVALID_XML_MESSAGE));
        }

        JsonNode order = payload.path("order");
        JsonNode head = order.path("head");
        String ogOrderId = head.path("orderOgId").asText("");
        String publicId = head.path("orderPublicId").asText("");

        log.info("OrderGroove order ogId={} publicId={} customer={} total={} {}",
                ogOrderId, publicId,
                order.path("customer").path("customerPartnerId").asText(""),
                head.path("orderTotalValue").asText(""),
                head.path("orderCurrency").asText(""));

        String eventId = !publicId.isBlank() ? publicId
                : !ogOrderId.isBlank() ? ogOrderId
                : "og_order_" + System.currentTimeMillis();

        Admission admission = coordinator.admit(new IncomingWebhook(
                eventId, PROVIDER, EVENT_TYPE, ogOrderId.isBlank() ? null : ogOrderId, toJson(payload)));
        if (admission.shouldRun()) {
            try {
                coordinator.complete(admission.rowId());
            } catch (RuntimeException ex) {
                WebhookProcessingException failure = new WebhookProcessingException("completion", String.valueOf(ex.getMessage()), ex);
                try {
                    coordinator.fail(admission.rowId(), failure.describe());
                } catch (RuntimeException recordEx) {
                    failure.addSuppressed(recordEx);
                }
                log.error("OrderGroove order {} could not be completed: {}", eventId, ex.getMessage());
                throw failure;
            }
        } else {
            log.info("OrderGroove order already received: {}", eventId);
        }

        return new OrderPlacementReply(200, successXml(ogOrderId.isBlank() ? eventId : ogOrderId));
    }

    /**
     * Converts an XML document into {@code {rootName: tree}}. Repeated elements become arrays and leaf
     * elements become trimmed text.
     *
     * @param xml document
     * @return JSON tree
     * @throws IOException when the document is malformed
     * @throws XMLStreamException when the root element cannot be read
     */
    ObjectNode parseOrderXml(String xml) throws IOException, XMLStreamException {
        if (xml == null || xml.isBlank()) {
            throw new IOException("Empty XML document");
        }
        JsonNode tree = xmlMapper.readTree(xml.trim());
        ObjectNode root = objectMapper.createObjectNode();
        root.set(rootElementName(xml.trim()), tree == null ? objectMapper.createObjectNode() : tree);
        return root;
    }

    private String rootElementName(String xml) throws XMLStreamException {
        XMLStreamReader reader = xmlMapper.getFactory().getXMLInputFactory().createXMLStreamReader(new StringReader(xml));
        try {
            reader.nextTag();
            return reader.getLocalName();
        } finally {
            reader.close();
        }
    }

    static String successXml(String orderId) {
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <order>
                  <code>SUCCESS</code>
                  <orderId>%s</orderId>
                </order>""".formatted(HtmlUtils.htmlEscape(orderId));
    }

    static String errorXml(String code, String message) {
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <order>
                  <code>ERROR</code>
                  <errorCode>%s</errorCode>
                  <errorMsg>%s</errorMsg>
                </order>""".formatted(code, HtmlUtils.htmlEscape(message));
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize order payload", e);
        }
    }
}
