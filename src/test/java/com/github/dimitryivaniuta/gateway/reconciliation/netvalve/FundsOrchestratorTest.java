package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.http.RawResponse;
import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;

class FundsOrchestratorTest {

    private NetValveGatewayClient gatewayClient;
    private FundsOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        gatewayClient = Mockito.mock(NetValveGatewayClient.class);
        orchestrator = new FundsOrchestrator(gatewayClient, new ObjectMapper());
    }

    @Test
    void alreadyCaptured_skipsGatewayCall() {
        FundsMovementResult r = orchestrator.capture("123", new BigDecimal("10"), true);

        Assertions.assertEquals(FundsMovementResult.CAPTURED, r.status());
        Assertions.assertTrue(r.data().isEmpty());
        Mockito.verifyNoInteractions(gatewayClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void capture_postsNumericTransactionIdAndRoundedAmount() {
        Mockito.when(gatewayClient.postTransaction(Mockito.eq("/capture"), Mockito.anyMap()))
                .thenReturn(response(200, "{\"responseCode\":\"GTW_1000\",\"responseMessage\":\"Captured\"}"));

        FundsMovementResult r = orchestrator.capture(" 123 ", new BigDecimal("10.005"), false);

        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        Mockito.verify(gatewayClient).postTransaction(Mockito.eq("/capture"), payload.capture());
        Assertions.assertEquals(123L, payload.getValue().get("transactionID"));
        Assertions.assertEquals(new BigDecimal("10.01"), payload.getValue().get("amount"));
        Assertions.assertEquals(FundsMovementResult.CAPTURED, r.status());
        Assertions.assertEquals("GTW_1000", r.responseCode());
        Assertions.assertFalse(r.isError());
    }

    @Test
    void refund_echoesAmount() {
        Mockito.when(gatewayClient.postTransaction(Mockito.eq("/refund"), Mockito.anyMap()))
                .thenReturn(response(200, "{\"responseCode\":\"GTW_1000\"}"));

        FundsMovementResult r = orchestrator.refund("55", new BigDecimal("4.5"));

        Assertions.assertEquals(FundsMovementResult.REFUNDED, r.status());
        Assertions.assertEquals(new BigDecimal("4.50"), r.refundedAmount());
    }

    @Test
    void cancel_serverErrorIsStillCanceledWithEmptyData() {
        Mockito.when(gatewayClient.postTransaction(Mockito.eq("/cancel"), Mockito.anyMap()))
                .thenReturn(response(503, "<html>down</html>"));

        FundsMovementResult r = orchestrator.cancel("55");

        Assertions.assertEquals(FundsMovementResult.CANCELED, r.status());
        Assertions.assertNull(r.responseCode());
    }

    @Test
    void nonNumericTransactionId_isError() {
        FundsMovementResult r = orchestrator.cancel("txn_abc");

        Assertions.assertEquals("cancel_error", r.status());
        Assertions.assertTrue(r.isError());
        Mockito.verifyNoInteractions(gatewayClient);
    }

    @Test
    void transportFailure_isError() {
        Mockito.when(gatewayClient.postTransaction(Mockito.eq("/refund"), Mockito.anyMap()))
                .thenThrow(new ResourceAccessException("Connection refused"));

        FundsMovementResult r = orchestrator.refund("55", BigDecimal.ONE);

        Assertions.assertEquals("refund_error", r.status());
        Assertions.assertEquals("Connection refused", r.error());
    }

    @Test
    void unparsableClientErrorBody_isError() {
        Mockito.when(gatewayClient.postTransaction(Mockito.eq("/capture"), Mockito.anyMap()))
                .thenReturn(response(400, "not json"));

        Assertions.assertEquals("capture_error", orchestrator.capture("1", BigDecimal.ONE, false).status());
    }

    private static RawResponse response(int status, String body) {
        return new RawResponse(status, new HttpHeaders(), body);
    }
}
