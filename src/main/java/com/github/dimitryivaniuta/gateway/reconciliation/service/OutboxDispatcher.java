package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.github.dimitryivaniuta.gateway.reconciliation.config.AppProperties;
import com.github.dimitryivaniuta.gateway.reconciliation.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.reconciliation.domain.OutboxStatus;
import com.github.dimitryivaniuta.gateway.reconciliation.repo.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Publishes reconciliation outbox events to Kafka.
 *
 * <ul>
 *   <li>Rows are locked with {@code FOR UPDATE SKIP LOCKED}; several instances can run side by side.</li>
 *   <li>An event is SENT only after the broker acknowledged it within {@code sendTimeout}.</li>
 *   <li>Failures back off exponentially with jitter and end as DEAD after {@code maxAttempts}.</li>
 * </ul>
 */
@Component
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    /**
     * Creates the dispatcher.
     *
     * @param outboxEventRepository repo
     * @param kafkaTemplate         template
     * @param properties            app properties
     * @param meterRegistry         metrics
     */
    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;

        this.sentCounter = Counter.builder("outbox.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("outbox.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("outbox.dead").register(meterRegistry);
    }

    /**
     * Publishes the next due batch.
     */
    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public void publishBatch() {
        AppProperties.Outbox outbox = properties.getOutbox();

        List<OutboxEvent> batch = outboxEventRepository.lockDueBatch(
                OutboxStatus.publishableNames(),
                Instant.now(),
                outbox.getBatchSize()
        );
        if (batch.isEmpty()) {
            return;
        }

        int sent = 0;
        for (OutboxEvent e : batch) {
            if (publish(e, outbox)) {
                sent++;
            }
            outboxEventRepository.save(e);
        }

        log.info("Outbox batch published. sent={} failed={} topic={}", sent, batch.size() - sent, outbox.getWebhookEventsTopic());
    }

    private boolean publish(OutboxEvent e, AppProperties.Outbox outbox) {
        try {
            kafkaTemplate.send(outbox.getWebhookEventsTopic(), e.getEventKey(), e.getPayload())
                    .get(outbox.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            e.markSent();
            sentCounter.increment();
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            scheduleRetry(e, outbox, safeError(ex));
            return false;
        } catch (Exception ex) {
            String err = safeError(ex);
            if (e.getAttemptCount() + 1 >= outbox.getMaxAttempts()) {
                e.markDead(err);
                deadCounter.increment();
                log.error("Outbox event {} ({}) DEAD after {} attempts. error={}", e.getId(), e.getEventType(), e.getAttemptCount(), err);
            } else {
                scheduleRetry(e, outbox, err);
            }
            return false;
        }
    }

    private void scheduleRetry(OutboxEvent e, AppProperties.Outbox outbox, String err) {
        Duration backoff = backoff(outbox.getBaseBackoff(), outbox.getMaxBackoff(), e.getAttemptCount() + 1);
        e.markRetry(err, backoff);
        retryCounter.increment();
        log.warn("Outbox event {} failed. attempt={} nextAttemptAt={} error={}",
                e.getId(), e.getAttemptCount(), e.getNextAttemptAt(), err);
    }

    static Duration backoff(Duration base, Duration max, int attempt) {
        // base * 2^(attempt-1), capped, jitter in [0.5, 1.5)
        long candidateMs = (long) (base.toMillis() * Math.pow(2.0, Math.max(0, attempt - 1)));
        long capped = Math.min(candidateMs, max.toMillis());
        long withJitter = (long) (capped * (0.5 + ThreadLocalRandom.current().nextDouble()));
        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(withJitter, max.toMillis())));
    }

    private static String safeError(Exception ex) {
        Throwable root = ex.getCause() != null ? ex.getCause() : ex;
        String msg = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        return msg.length() > MAX_ERROR_LENGTH ? msg.substring(0, MAX_ERROR_LENGTH) : msg;
    }
}
