package com.github.dimitryivaniuta.gateway.reconciliation.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.AuthorizationOrchestrator;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.FundsMovementResult;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.FundsOrchestrator;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.HpfSessionOrchestrator;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.WebhookAction;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.WebhookClassification;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.SessionFailure;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto.SessionOutcome;
import com.github.dimitryivaniuta.gateway.reconciliation.service.NetValveWebhookHandler;
import com.github.dimitryivaniuta.gateway.reconciliation.service.OrderGrooveOrderHandler;
import com.github.dimitryivaniuta.gateway.reconciliation.service.SolidgateWebhookHandler;
import com.github.dimitryivaniuta.gateway.reconciliation.service.WebhookProcessingException;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.WebhookAck;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * HTTP mapping of the webhook, order placement and card gateway endpoints.
 */
@WebMvcTest(controllers = {WebhooksController.class, OrderGrooveOrderController.class, NetValveController.class})
class ControllersWebLayerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    SolidgateWebhookHandler solidgateHandler;

    @MockBean
    OrderGrooveOrderHandler orderGrooveHandler;

    @MockBean
    HpfSessionOrchestrator sessionOrchestrator;

    @MockBean
    AuthorizationOrchestrator authorizationOrchestrator;

    @MockBean
    FundsOrchestrator fundsOrchestrator;

    @MockBean
    NetValveWebhookHandler netValveWebhookHandler;

    @Test
    void solidgateWithoutEventIdIsRejected() throws Exception {
        mvc.perform(post("/api/v1/webhooks/solidgate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"order\":{\"status\":\"settle_ok\"}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(solidgateHandler);
    }

    @Test
    void solidgateNonObjectBodyIsRejected() throws Exception {
        mvc.perform(post("/api/v1/webhooks/solidgate")
                        .header(WebhooksController.SOLIDGATE_EVENT_ID_HEADER, "ev_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1,2]"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(solidgateHandler);
    }

    @Test
    void solidgateAckIsReturnedAndCorrelationIdEchoed() throws Exception {
        when(solidgateHandler.handle(eq("ev_1"), eq("order.updated"), any(), anyString()))
                .thenReturn(WebhookAck.alreadyProcessed());

        mvc.perform(post("/api/v1/webhooks/solidgate")
                        .header(WebhooksController.SOLIDGATE_EVENT_ID_HEADER, " ev_1 ")
                        .header(WebhooksController.SOLIDGATE_EVENT_TYPE_HEADER, "order.updated")
                        .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"order\":{\"status\":\"settle_ok\"}}"))
                .andExpect(status().isOk())
                .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-7"))
                .andExpect(jsonPath("$.message").value(WebhookAck.ALREADY_PROCESSED))
                .andExpect(jsonPath("$.success").doesNotExist());
    }

    @Test
    void processingFailureMapsTo500WithStep() throws Exception {
        when(solidgateHandler.handle(eq("ev_2"), any(), any(), anyString()))
                .thenThrow(new WebhookProcessingException("cart_lookup", "Cart not found"));

        mvc.perform(post("/api/v1/webhooks/solidgate")
                        .header(WebhooksController.SOLIDGATE_EVENT_ID_HEADER, "ev_2")
                        .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-500")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"order\":{\"status\":\"settle_ok\"}}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("WEBHOOK_PROCESSING_ERROR"))
                .andExpect(jsonPath("$.correlation_id").value("corr-500"))
                .andExpect(jsonPath("$.step").value("cart_lookup"))
                .andExpect(jsonPath("$.message").value("Cart not found"));
    }

    @Test
    void orderGrooveWebhookEchoesPayload() throws Exception {
        mvc.perform(post("/api/v1/webhooks/ordergroove")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subscription\":\"sub_1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status_code").value(200))
                .andExpect(jsonPath("$.data.subscription").value("sub_1"));
    }

    @Test
    void orderPlacementReadsFormFieldAndAnswersXml() throws Exception {
        when(orderGrooveHandler.handle("<order><head/></order>"))
                .thenReturn(new OrderGrooveOrderHandler.OrderPlacementReply(200, "<order><code>success</code></order>"));

        mvc.perform(post("/api/v1/ordergroove/order-placement")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "og")
                        .param("password", "secret")
                        .param("xml", " <order><head/></order> "))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_XML))
                .andExpect(content().string("<order><code>success</code></order>"));
    }

    @Test
    void sessionFailureStatusIsPassedThrough() throws Exception {
        when(sessionOrchestrator.initialize(any())).thenReturn(SessionOutcome.failed(502,
                new SessionFailure("Failed to initialize payment session", "check NETVALVE_CLIENT_ID", null, null)));

        mvc.perform(post("/api/v1/netvalve/hpf/session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currency_code\":\"eur\",\"amount\":12.5}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("Failed to initialize payment session"))
                .andExpect(jsonPath("$.diagnostic").value("check NETVALVE_CLIENT_ID"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void sessionWithoutBodyStillRunsTheWaterfall() throws Exception {
        when(sessionOrchestrator.initialize(any())).thenReturn(SessionOutcome.failed(500,
                new SessionFailure("Failed to initialize payment session", null, null, "boom")));

        mvc.perform(post("/api/v1/netvalve/hpf/session"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("boom"));

        verify(sessionOrchestrator).initialize(any());
    }

    @Test
    void captureWithoutTransactionIdIsAValidationError() throws Exception {
        mvc.perform(post("/api/v1/netvalve/capture")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":10.01}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(fundsOrchestrator);
    }

    @Test
    void captureDelegatesWithSnakeCaseFields() throws Exception {
        when(fundsOrchestrator.capture("812", new BigDecimal("10.01"), false)).thenReturn(
                new FundsMovementResult(FundsMovementResult.CAPTURED, "812", null, "00", "Approved", null, null));

        mvc.perform(post("/api/v1/netvalve/capture")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transaction_id\":\"812\",\"amount\":10.01}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("captured"))
                .andExpect(jsonPath("$.transaction_id").value("812"))
                .andExpect(jsonPath("$.response_message").value("Approved"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void paymentBodyMustBeAnObject() throws Exception {
        mvc.perform(post("/api/v1/netvalve/payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("\"card\""))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(authorizationOrchestrator);
    }

    @Test
    void gatewayWebhookReturnsClassification() throws Exception {
        when(netValveWebhookHandler.handle(any(), anyString())).thenReturn(
                new WebhookClassification(WebhookAction.SUCCESSFUL, new WebhookClassification.Data("sess_1", 25)));

        mvc.perform(post("/api/v1/netvalve/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"payment.captured\",\"session_id\":\"sess_1\",\"amount\":25}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("SUCCESSFUL"))
                .andExpect(jsonPath("$.data.session_id").value("sess_1"))
                .andExpect(jsonPath("$.data.amount").value(25));
    }

    @Test
    void statusIsNormalized() throws Exception {
        mvc.perform(get("/api/v1/netvalve/status").param("status", "Captured").param("transaction_id", "812"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("captured"))
                .andExpect(jsonPath("$.transaction_id").value("812"));

        mvc.perform(get("/api/v1/netvalve/status").param("status", "settled"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"));

        mvc.perform(get("/api/v1/netvalve/status"))
                .andExpect(jsonPath("$.status").value("pending"));
    }
}
