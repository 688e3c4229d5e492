package com.github.dimitryivaniuta.gateway.reconciliation.repo;

import com.github.dimitryivaniuta.gateway.reconciliation.domain.OutboxEvent;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link OutboxEvent}.
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    /**
     * Locks the next batch of events due for publishing.
     *
     * <p>{@code FOR UPDATE SKIP LOCKED} lets several dispatcher instances share the table without
     * publishing the same row twice.</p>
     *
     * @param statuses statuses to fetch (NEW, RETRY)
     * @param now current timestamp
     * @param limit batch size
     * @return locked batch
     */
    @Query(value = """
            select *
            from outbox_events
            where status in (:statuses)
              and (next_attempt_at is null or next_attempt_at <= :now)
            order by created_at
            limit :limit
            for update skip locked
            """, nativeQuery = true)
    List<OutboxEvent> lockDueBatch(
            @Param("statuses") List<String> statuses,
            @Param("now") Instant now,
            @Param("limit") int limit
    );

    /**
     * Events derived from one webhook row.
     *
     * @param webhookEventId webhook row id
     * @return events
     */
    List<OutboxEvent> findByWebhookEventId(String webhookEventId);
}
