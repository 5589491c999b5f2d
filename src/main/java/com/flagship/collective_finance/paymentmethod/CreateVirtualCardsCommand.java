package com.flagship.collective_finance.paymentmethod;

import com.flagship.collective_finance.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Batch of virtual cards to mint from one of {@code accountId}'s payment
 * methods.
 *
 * <p>Either {@code emails} (one invited card per address) or
 * {@code numberOfVirtualCards} (unbound cards) selects the batch. When both
 * are present their sizes must agree.
 */
@Value
@Builder
public class CreateVirtualCardsCommand {
    UUID accountId;
    UUID paymentMethodId;
    List<String> emails;
    Integer numberOfVirtualCards;
    CurrencyCode currency;
    BigDecimal amount;
    BigDecimal monthlyLimitPerMember;
    List<String> limitedToTags;
    List<UUID> limitedToCollectiveIds;
    List<UUID> limitedToHostCollectiveIds;
    boolean limitedToOpenSourceCollectives;
    String description;
    String customMessage;
    LocalDate expiryDate;

    boolean hasEmails() {
        return emails != null && !emails.isEmpty();
    }

    boolean hasCount() {
        return numberOfVirtualCards != null && numberOfVirtualCards > 0;
    }
}
