package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.http.RawResponse;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

/**
 * Capture, refund and cancel of NetValve transactions.
 *
 * <p>Each is one POST. Transport failures, unparsable bodies and non-numeric transaction ids end in
 * {@code capture_error}, {@code refund_error} or {@code cancel_error}; nothing is thrown.</p>
 */
@Service
public class FundsOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FundsOrchestrator.class);

    private final NetValveGatewayClient gatewayClient;
    private final ObjectMapper objectMapper;

    /**
     * Creates the orchestrator.
     *
     * @param gatewayClient payment API client
     * @param objectMapper JSON mapper
     */
    public FundsOrchestrator(NetValveGatewayClient gatewayClient, ObjectMapper objectMapper) {
        this.gatewayClient = gatewayClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Captures authorized funds. A sale that ran in capture mode already moved the funds; pass
     * {@code alreadyCaptured} to skip the call.
     *
     * @param transactionId transaction id
     * @param amount amount to capture
     * @param alreadyCaptured skip the gateway call
     * @return result
     */
    public FundsMovementResult capture(String transactionId, BigDecimal amount, boolean alreadyCaptured) {
        if (alreadyCaptured) {
            log.info("NetValve capture of {} skipped, sale already captured", transactionId);
            return new FundsMovementResult(FundsMovementResult.CAPTURED, transactionId, null, null, null, null,
                    objectMapper.createObjectNode());
        }
        return post("/capture", FundsMovementResult.CAPTURED, transactionId, round(amount), false);
    }

    /**
     * @param transactionId transaction id
     * @param amount amount to refund
     * @return result
     */
    public FundsMovementResult refund(String transactionId, BigDecimal amount) {
        return post("/refund", FundsMovementResult.REFUNDED, transactionId, round(amount), true);
    }

    /**
     * Voids an authorization.
     *
     * @param transactionId transaction id
     * @return result
     */
    public FundsMovementResult cancel(String transactionId) {
        return post("/cancel", FundsMovementResult.CANCELED, transactionId, null, false);
    }

    private FundsMovementResult post(String path, String okStatus, String transactionId, BigDecimal amount, boolean echoAmount) {
        String errorStatus = path.substring(1) + "_error";
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("transactionID", Long.parseLong(transactionId.trim()));
            if (amount != null) {
                payload.put("amount", amount);
            }

            RawResponse resp = gatewayClient.postTransaction(path, payload);
            JsonNode parsed = resp.status() < 500 ? objectMapper.readTree(resp.body()) : objectMapper.createObjectNode();
            if (parsed == null || parsed.isMissingNode()) {
                throw new IllegalStateException("Empty response body, HTTP " + resp.status());
            }
            String responseCode = text(parsed, "responseCode");
            log.info("NetValve POST {} HTTP {} responseCode={}", path, resp.status(), responseCode == null ? "N/A" : responseCode);

            return new FundsMovementResult(okStatus, transactionId, echoAmount ? amount : null,
                    responseCode, text(parsed, "responseMessage"), null, parsed);
        } catch (RestClientException | JsonProcessingException | NumberFormatException | IllegalStateException ex) {
            log.error("NetValve POST {} error: {}", path, ex.getMessage());
            return new FundsMovementResult(errorStatus, transactionId, null, null, null,
                    String.valueOf(ex.getMessage()), objectMapper.createObjectNode());
        }
    }

    private static BigDecimal round(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO.setScale(2) : amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isValueNode() && !v.isNull() ? v.asText() : null;
    }
}
