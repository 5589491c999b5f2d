package com.flagship.collective_finance.notification;

import lombok.Value;

import java.util.UUID;

@Value
public class WelcomeNotification implements NotificationEvent {

    public static final String EVENT_TYPE = "UserWelcome";

    UUID userAccountId;
    String recipientEmail;
    String userName;
    UUID organizationId;
    String organizationName;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return userAccountId;
    }
}
