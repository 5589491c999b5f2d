package com.flagship.collective_finance.notification;

import com.flagship.collective_finance.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Invites {@code recipientEmail} to claim a virtual card with {@code claimCode}.
 */
@Value
@Builder
public class VirtualCardInvitationNotification implements NotificationEvent {

    public static final String EVENT_TYPE = "VirtualCardInvitation";

    UUID paymentMethodId;
    String recipientEmail;
    String claimCode;
    UUID issuerAccountId;
    String issuerName;
    BigDecimal initialBalance;
    BigDecimal monthlyLimitPerMember;
    CurrencyCode currency;
    LocalDate expiryDate;
    String customMessage;
    Instant issuedAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return paymentMethodId;
    }
}
