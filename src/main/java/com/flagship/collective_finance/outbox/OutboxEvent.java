package com.flagship.collective_finance.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification waiting in the outbox table.
 *
 * Written in the same unit of work as the mutation that caused it and
 * published to Kafka only once that unit of work has committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Notification"
    UUID aggregateId;          // card or account the notification is about
    String eventType;          // "VirtualCardInvitation", "UserWelcome"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(String aggregateType, UUID aggregateId,
                                      String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
                Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * Whether the publisher has given up on this event.
     */
    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
