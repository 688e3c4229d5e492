package com.github.dimitryivaniuta.gateway.reconciliation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.reconciliation.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.reconciliation.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.gateway.reconciliation.service.dto.Admission;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Completes an admitted webhook and records the resulting outbox event.
 */
@Service
public class ReconciliationEventWriter {

    private final IdempotencyCoordinator coordinator;
    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    /**
     * Creates the writer.
     *
     * @param coordinator idempotency coordinator
     * @param outboxEventRepository outbox repository
     * @param objectMapper jackson mapper
     */
    public ReconciliationEventWriter(
            IdempotencyCoordinator coordinator,
            OutboxEventRepository outboxEventRepository,
            ObjectMapper objectMapper
    ) {
        this.coordinator = coordinator;
        this.outboxEventRepository = outboxEventRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Marks the webhook processed and writes the outbox row in one transaction.
     *
     * @param admission admission that ran the side effect
     * @param eventType outbox event type
     * @param eventKey kafka key
     * @param event event body
     */
    @Transactional
    public void completeWithEvent(Admission admission, String eventType, String eventKey, Object event) {
        coordinator.complete(admission.rowId());
        outboxEventRepository.save(OutboxEvent.pending(
                admission.event().getProvider(),
                admission.rowId(),
                eventType,
                eventKey == null || eventKey.isBlank() ? admission.event().getEventId() : eventKey,
                toJson(event)
        ));
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize outbox payload", e);
        }
    }
}
