package com.github.dimitryivaniuta.gateway.reconciliation;

import com.github.dimitryivaniuta.gateway.reconciliation.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.reconciliation.domain.OutboxStatus;
import com.github.dimitryivaniuta.gateway.reconciliation.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.gateway.reconciliation.service.OutboxDispatcher;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Verifies that the outbox dispatcher publishes NEW events and marks them SENT (ack-based), and that a
 * failed send is scheduled for retry.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
class OutboxDispatcherTest {

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
        r.add("app.outbox.publish-interval-ms", () -> "9999999"); // avoid background interference
    }

    @MockBean
    KafkaTemplate<String, String> kafkaTemplate;

    @Autowired
    OutboxEventRepository repo;

    @Autowired
    OutboxDispatcher dispatcher;

    @Test
    void dispatcherMarksSent() {
        OutboxEvent e = OutboxEvent.pending("solidgate", "row-1", "WebhookSettled", "cart_42", "{\"ok\":true}");
        repo.save(e);

        // Kafka send must return an already-completed future (ack success).
        CompletableFuture<SendResult<String, String>> ok = CompletableFuture.completedFuture(null);
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString())).thenReturn(ok);

        dispatcher.publishBatch();

        OutboxEvent updated = repo.findById(e.getId()).orElseThrow();
        Assertions.assertEquals(OutboxStatus.SENT, updated.getStatus());

        ArgumentCaptor<String> topic = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);

        Mockito.verify(kafkaTemplate).send(topic.capture(), key.capture(), payload.capture());

        Assertions.assertEquals("payment-webhook-events", topic.getValue());
        Assertions.assertEquals("cart_42", key.getValue());
        Assertions.assertEquals("{\"ok\":true}", payload.getValue());
    }

    @Test
    void failedSendIsScheduledForRetry() {
        OutboxEvent e = OutboxEvent.pending("netvalve", "row-2", "PaymentWebhookClassified", "sess_1", "{}");
        repo.save(e);

        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        dispatcher.publishBatch();

        OutboxEvent updated = repo.findById(e.getId()).orElseThrow();
        Assertions.assertEquals(OutboxStatus.RETRY, updated.getStatus());
        Assertions.assertEquals(1, updated.getAttemptCount());
        Assertions.assertEquals("broker down", updated.getLastError());
        Assertions.assertNotNull(updated.getNextAttemptAt());
    }
}
