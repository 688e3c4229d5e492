package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.alert.AlertNotifier;
import com.github.dimitryivaniuta.gateway.reconciliation.domain.WebhookEvent;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.WebhookAction;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.WebhookClassification;
import com.github.dimitryivaniuta.gateway.reconciliation.netvalve.WebhookEventClassifier;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.Admission;
import com.github.dimitryivaniuta.gateway.reconciliation.service.events.PaymentWebhookClassifiedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class NetValveWebhookHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private InMemoryWebhookEventStore store;
    private IdempotencyCoordinator coordinator;
    private ReconciliationEventWriter eventWriter;
    private AlertNotifier alertNotifier;
    private NetValveWebhookHandler handler;

    @BeforeEach
    void setUp() {
        store = new InMemoryWebhookEventStore();
        coordinator = new IdempotencyCoordinator(store, new SimpleMeterRegistry());
        eventWriter = Mockito.mock(ReconciliationEventWriter.class);
        Mockito.doAnswer(inv -> {
            coordinator.complete(inv.<Admission>getArgument(0).rowId());
            return null;
        }).when(eventWriter).completeWithEvent(Mockito.any(), Mockito.anyString(), Mockito.any(), Mockito.any());
        alertNotifier = Mockito.mock(AlertNotifier.class);
        handler = new NetValveWebhookHandler(new WebhookEventClassifier(), coordinator, eventWriter, alertNotifier);
    }

    @Test
    void classifiedEventIsRecordedOnceAndPublished() throws Exception {
        String raw = "{\"id\":\"evt_1\",\"type\":\"Payment.Captured\",\"session_id\":\"sess_1\",\"amount\":12.5,\"order_id\":\"ord_1\"}";

        WebhookClassification first = handler.handle(json(raw), raw);
        WebhookClassification second = handler.handle(json(raw), raw);

        Assertions.assertEquals(WebhookAction.SUCCESSFUL, first.action());
        Assertions.assertEquals(WebhookAction.SUCCESSFUL, second.action());

        WebhookEvent row = store.findByEventId("netvalve_evt_1_payment.captured").orElseThrow();
        Assertions.assertTrue(row.isProcessed());
        Assertions.assertEquals("ord_1", row.getCorrelationId());

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        Mockito.verify(eventWriter, Mockito.times(1))
                .completeWithEvent(Mockito.any(), Mockito.eq("PaymentWebhookClassified"), Mockito.eq("sess_1"), event.capture());
        PaymentWebhookClassifiedEvent published = (PaymentWebhookClassifiedEvent) event.getValue();
        Assertions.assertEquals("SUCCESSFUL", published.action());
        Assertions.assertEquals("12.5", published.amount());
    }

    @Test
    void webhookWithoutIdentity_isClassifiedButNotRecorded() throws Exception {
        String raw = "{\"type\":\"payment.failed\"}";

        WebhookClassification c = handler.handle(json(raw), raw);

        Assertions.assertEquals(WebhookAction.FAILED, c.action());
        Assertions.assertEquals(0, store.size());
        Mockito.verifyNoInteractions(eventWriter);
    }

    @Test
    void completionFailure_marksRowFailedAlertsAndRedeliveryRetries() throws Exception {
        String raw = "{\"id\":\"evt_2\",\"type\":\"payment.authorized\",\"session_id\":\"sess_2\",\"amount\":5}";
        Mockito.doThrow(new IllegalStateException("outbox down"))
                .doAnswer(inv -> {
                    coordinator.complete(inv.<Admission>getArgument(0).rowId());
                    return null;
                })
                .when(eventWriter).completeWithEvent(Mockito.any(), Mockito.anyString(), Mockito.any(), Mockito.any());

        WebhookProcessingException ex = Assertions.assertThrows(WebhookProcessingException.class, () -> handler.handle(json(raw), raw));
        Assertions.assertEquals("completion", ex.getStep());

        WebhookEvent row = store.findByEventId("netvalve_evt_2_payment.authorized").orElseThrow();
        Assertions.assertFalse(row.isProcessed());
        Assertions.assertEquals("completion: outbox down", row.getErrorMessage());
        Mockito.verify(alertNotifier).sendCriticalAlert(Mockito.anyString(), Mockito.contains("netvalve_evt_2_payment.authorized"), Mockito.eq("NetValve"));

        handler.handle(json(raw), raw);

        Assertions.assertTrue(store.findByEventId("netvalve_evt_2_payment.authorized").orElseThrow().isProcessed());
        Mockito.verify(eventWriter, Mockito.times(2)).completeWithEvent(Mockito.any(), Mockito.anyString(), Mockito.any(), Mockito.any());
    }

    @Test
    void eventId_usesFirstAvailableIdentifier() throws Exception {
        Assertions.assertEquals("netvalve_s1_payment.pending",
                NetValveWebhookHandler.eventId(json("{\"session_id\":\"s1\",\"transaction_id\":\"t1\"}"), "payment.pending"));
        Assertions.assertEquals("netvalve_t1_x",
                NetValveWebhookHandler.eventId(json("{\"transaction_id\":\"t1\"}"), "X"));
        Assertions.assertNull(NetValveWebhookHandler.eventId(json("{\"id\":\"a\"}"), null));
    }

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }
}
