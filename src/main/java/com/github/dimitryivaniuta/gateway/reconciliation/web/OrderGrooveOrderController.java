package com.github.dimitryivaniuta.gateway.reconciliation.web;

import com.github.dimitryivaniuta.gateway.reconciliation.service.OrderGrooveOrderHandler;
import com.github.dimitryivaniuta.gateway.reconciliation.service.OrderGrooveOrderHandler.OrderPlacementReply;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * OrderGroove recurring order placement.
 *
 * <p>OrderGroove posts {@code username=&password=&xml=<order>} form-encoded; a raw XML body is accepted
 * too. The answer is always an XML envelope.</p>
 */
@RestController
@RequestMapping("/api/v1/ordergroove")
public class OrderGrooveOrderController {

    private final OrderGrooveOrderHandler handler;

    /**
     * Creates the controller.
     *
     * @param handler order handler
     */
    public OrderGrooveOrderController(OrderGrooveOrderHandler handler) {
        this.handler = handler;
    }

    /**
     * @param request servlet request
     * @return XML envelope
     * @throws IOException when the body cannot be read
     */
    @PostMapping(value = "/order-placement", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> orderPlacement(HttpServletRequest request) throws IOException {
        String xml = request.getParameter("xml");
        if (xml == null) {
            xml = StreamUtils.copyToString(request.getInputStream(), StandardCharsets.UTF_8);
        }
        OrderPlacementReply reply = handler.handle(xml.trim());
        return ResponseEntity.status(reply.httpStatus()).contentType(MediaType.APPLICATION_XML).body(reply.xml());
    }
}
