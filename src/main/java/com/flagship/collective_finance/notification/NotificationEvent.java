package com.flagship.collective_finance.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.UUID;

/**
 * A message for the email sink. Serialized as JSON into the outbox; the
 * {@code eventType} property tells the downstream mailer which template
 * to render.
 */
public interface NotificationEvent {

    String getEventType();

    String getRecipientEmail();

    /**
     * Entity the notification is about; becomes the Kafka record key.
     */
    @JsonIgnore
    UUID getAggregateId();
}
