package com.github.dimitryivaniuta.gateway.reconciliation.repo;

import com.github.dimitryivaniuta.gateway.reconciliation.domain.WebhookEvent;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link WebhookEvent}.
 */
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, String> {

    /**
     * Finds an event by provider event id.
     *
     * @param eventId provider event id
     * @return event if present
     */
    Optional<WebhookEvent> findByEventId(String eventId);

    /**
     * Clears the error of a failed event, claiming it for one retry.
     *
     * <p>The {@code error_message is not null} predicate makes the claim atomic: when two redeliveries
     * race, only one update matches.</p>
     *
     * @param id row id
     * @param now update timestamp
     * @return number of rows claimed (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update WebhookEvent e
               set e.errorMessage = null, e.updatedAt = :now
             where e.id = :id
               and e.errorMessage is not null
               and e.processed = false
            """)
    int claimForRetry(@Param("id") String id, @Param("now") Instant now);
}
