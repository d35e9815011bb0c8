package com.flagship.pledge_ledger.outbox;

import com.flagship.pledge_ledger.payment.LedgerKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxMessageRepository extends JpaRepository<OutboxMessage, UUID> {

    /**
     * Oldest undelivered messages still worth retrying. Rows are locked until
     * the caller's transaction ends; a second publisher skips them.
     */
    @Query(value = """
        SELECT * FROM notification_outbox
        WHERE delivered_at IS NULL AND attempts < :maxAttempts
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxMessage> lockDeliverable(@Param("maxAttempts") int maxAttempts, @Param("limit") int limit);

    List<OutboxMessage> findByRecordKindAndRecordIdOrderBySequenceNumberAsc(LedgerKind recordKind, long recordId);

    long countByDeliveredAtIsNull();

    long countByDeliveredAtIsNullAndAttemptsGreaterThanEqual(int attempts);

    @Query("SELECT MIN(m.createdAt) FROM OutboxMessage m WHERE m.deliveredAt IS NULL")
    Optional<Instant> oldestUndeliveredCreatedAt();
}
