package com.flagship.group_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact recorded by the ledger, written to the outbox in the same unit of
 * work as the state change it describes.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    /**
     * {@code Expense} or {@code Settlement}.
     */
    String getAggregateType();

    /**
     * Id of the expense or settlement; also the Kafka record key.
     */
    String getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
