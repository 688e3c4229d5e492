package com.github.dimitryivaniuta.gateway.reconciliation;

import com.github.dimitryivaniuta.gateway.reconciliation.alert.AlertNotifier;
import com.github.dimitryivaniuta.gateway.reconciliation.domain.OutboxStatus;
import com.github.dimitryivaniuta.gateway.reconciliation.domain.WebhookEvent;
import com.github.dimitryivaniuta.gateway.reconciliation.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.gateway.reconciliation.repo.WebhookEventRepository;
import com.github.dimitryivaniuta.gateway.reconciliation.service.SettlementService;
import com.github.dimitryivaniuta.gateway.reconciliation.service.WebhookProcessingException;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.SettlementReceipt;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Solidgate deliveries against a real Postgres: concurrent twins settle once, and a failed settlement
 * is retried by the next delivery.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class WebhookIdempotencyEndToEndTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("reconciler")
            .withUsername("reconciler")
            .withPassword("reconciler");

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
        r.add("spring.kafka.bootstrap-servers", () -> "localhost:0");
        r.add("app.outbox.publish-interval-ms", () -> "9999999");
    }

    @Autowired
    TestRestTemplate rest;

    @Autowired
    WebhookEventRepository webhookEventRepository;

    @Autowired
    OutboxEventRepository outboxEventRepository;

    @MockBean
    SettlementService settlementService;

    @MockBean
    AlertNotifier alertNotifier;

    @MockBean
    KafkaTemplate<String, String> kafkaTemplate;

    @Test
    void concurrentTwinDeliveries_settleExactlyOnce() throws Exception {
        Mockito.when(settlementService.settle("cart_42")).thenAnswer(inv -> {
            Thread.sleep(200);
            return new SettlementReceipt("cart_42", "ps_1", "pc_1", "pay_1", null, "usd", null);
        });

        int callers = 2;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ResponseEntity<String>>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return postSolidgate("ev_1", "cart_42");
                }));
            }
            start.countDown();

            for (Future<ResponseEntity<String>> f : futures) {
                Assertions.assertEquals(200, f.get(30, TimeUnit.SECONDS).getStatusCode().value());
            }
        } finally {
            pool.shutdownNow();
        }

        Mockito.verify(settlementService, Mockito.times(1)).settle("cart_42");

        WebhookEvent row = webhookEventRepository.findByEventId("ev_1").orElseThrow();
        Assertions.assertTrue(row.isProcessed());
        Assertions.assertEquals(1, outboxEventRepository.findByWebhookEventId(row.getId()).size());
        Assertions.assertEquals(OutboxStatus.NEW, outboxEventRepository.findByWebhookEventId(row.getId()).get(0).getStatus());

        ResponseEntity<String> redelivery = postSolidgate("ev_1", "cart_42");
        Assertions.assertEquals(200, redelivery.getStatusCode().value());
        Assertions.assertTrue(redelivery.getBody().contains("Event already processed"));
        Mockito.verify(settlementService, Mockito.times(1)).settle("cart_42");
    }

    @Test
    void failedSettlement_returns500_andRedeliveryRetries() {
        Mockito.when(settlementService.settle("cart_77"))
                .thenThrow(new WebhookProcessingException(SettlementService.STEP_CART_LOOKUP, "No payment session found for cart cart_77"))
                .thenReturn(new SettlementReceipt("cart_77", "ps_7", "pc_7", "pay_7", null, "usd", null));

        ResponseEntity<String> first = postSolidgate("ev_77", "cart_77");
        Assertions.assertEquals(500, first.getStatusCode().value());
        Assertions.assertTrue(first.getBody().contains("cart_lookup"));

        WebhookEvent failed = webhookEventRepository.findByEventId("ev_77").orElseThrow();
        Assertions.assertFalse(failed.isProcessed());
        Assertions.assertNotNull(failed.getErrorMessage());

        ResponseEntity<String> second = postSolidgate("ev_77", "cart_77");
        Assertions.assertEquals(200, second.getStatusCode().value());

        WebhookEvent settled = webhookEventRepository.findByEventId("ev_77").orElseThrow();
        Assertions.assertTrue(settled.isProcessed());
        Assertions.assertNull(settled.getErrorMessage());
        Assertions.assertEquals(failed.getId(), settled.getId());
    }

    @Test
    void eventIdTooLongForColumn_returns500WithoutSettling() {
        String eventId = "ev_" + "x".repeat(300);

        ResponseEntity<String> resp = postSolidgate(eventId, "cart_long");

        Assertions.assertEquals(500, resp.getStatusCode().value());
        Assertions.assertTrue(resp.getBody().contains("admission"));
        Assertions.assertTrue(webhookEventRepository.findByEventId(eventId).isEmpty());
        Mockito.verify(settlementService, Mockito.never()).settle("cart_long");
    }

    @Test
    void missingEventIdHeader_isRejected() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> resp = rest.postForEntity("/api/v1/webhooks/solidgate",
                new HttpEntity<>(body("cart_1"), headers), String.class);

        Assertions.assertEquals(400, resp.getStatusCode().value());
    }

    private ResponseEntity<String> postSolidgate(String eventId, String cartId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("solidgate-event-id", eventId);
        headers.set("solidgate-event-type", "order.updated");
        return rest.postForEntity("/api/v1/webhooks/solidgate", new HttpEntity<>(body(cartId), headers), String.class);
    }

    private static String body(String cartId) {
        return "{\"order\":{\"order_id\":\"" + cartId + "\",\"status\":\"settle_ok\"}}";
    }
}
