package com.flagship.collective_finance.paymentmethod;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountService;
import com.flagship.collective_finance.auth.Action;
import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.AuthorizationTarget;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.config.FinanceProperties;
import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.error.ExternalDependencyException;
import com.flagship.collective_finance.error.NotFoundException;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.notification.NotificationDispatcher;
import com.flagship.collective_finance.notification.VirtualCardInvitationNotification;
import com.flagship.collective_finance.observability.MutationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Batch issuance of virtual cards.
 *
 * <p>A batch is all-or-nothing. Every card is planned and validated in
 * memory first, the whole batch is then persisted with one
 * {@code saveAll}, and invitations are queued last. Invitations travel
 * through the outbox, so none is sent unless every card committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VirtualCardService {

    private static final int MAX_CLAIM_CODE_ATTEMPTS = 10;

    private final PaymentMethodRepository paymentMethodRepository;
    private final AccountService accountService;
    private final NotificationDispatcher notificationDispatcher;
    private final ClaimCodeGenerator claimCodeGenerator;
    private final AuthorizationGuard guard;
    private final FinanceProperties properties;
    private final MutationMetrics metrics;
    private final Clock clock;

    @Transactional
    public List<PaymentMethodEntity> createVirtualCards(CreateVirtualCardsCommand command, Principal principal) {
        long startTime = System.currentTimeMillis();
        AccountEntity issuer = accountService.getRequired(command.getAccountId());
        guard.require(principal, Action.CREATE_VIRTUAL_CARDS, AuthorizationTarget.account(issuer.getId()));

        try {
            int batchSize = validateBatchShape(command);
            List<UUID> hostLimit = resolveHostLimit(command);
            PaymentMethodEntity parent = resolveParent(command, issuer);
            CurrencyCode currency = command.getCurrency() != null ? command.getCurrency() : parent.getCurrency();
            if (currency != parent.getCurrency()) {
                throw new ValidationException(String.format("Virtual card currency %s does not match the currency %s of payment method %s",
                        currency, parent.getCurrency(), parent.getId()));
            }
            requireBudget(command);

            List<String> recipients = command.hasEmails() ? normalizedEmails(command.getEmails()) : Collections.nCopies(batchSize, null);
            LocalDate expiryDate = command.getExpiryDate() != null
                    ? command.getExpiryDate()
                    : LocalDate.now(clock).plusMonths(properties.getVirtualCards().getDefaultExpiryMonths());
            Set<String> codesInBatch = new HashSet<>();

            List<PaymentMethodEntity> planned = new ArrayList<>(batchSize);
            for (String recipient : recipients) {
                planned.add(PaymentMethodEntity.from(NewPaymentMethod.builder()
                        .name(command.getDescription() != null ? command.getDescription() : issuer.getName() + " virtual card")
                        .description(command.getDescription())
                        .type(PaymentMethodType.VIRTUAL_CARD)
                        .provider(PaymentProvider.INTERNAL)
                        .currency(currency)
                        .accountId(issuer.getId())
                        .initialBalance(command.getAmount())
                        .monthlyLimitPerMember(command.getMonthlyLimitPerMember())
                        .limitedToTags(command.getLimitedToTags())
                        .limitedToCollectiveIds(command.getLimitedToCollectiveIds())
                        .limitedToHostCollectiveIds(hostLimit)
                        .expiryDate(expiryDate)
                        .parentPaymentMethodId(parent.getId())
                        .recipientEmail(recipient)
                        .claimCode(uniqueClaimCode(codesInBatch))
                        .createdByUserId(principal.getUserAccountId())
                        .build()));
            }

            List<PaymentMethodEntity> cards = paymentMethodRepository.saveAll(planned);

            Instant issuedAt = Instant.now(clock);
            List<VirtualCardInvitationNotification> invitations = cards.stream()
                    .filter(card -> card.getRecipientEmail() != null)
                    .map(card -> VirtualCardInvitationNotification.builder()
                            .paymentMethodId(card.getId())
                            .recipientEmail(card.getRecipientEmail())
                            .claimCode(card.getClaimCode())
                            .issuerAccountId(issuer.getId())
                            .issuerName(issuer.getName())
                            .initialBalance(card.getInitialBalance())
                            .monthlyLimitPerMember(card.getMonthlyLimitPerMember())
                            .currency(card.getCurrency())
                            .expiryDate(card.getExpiryDate())
                            .customMessage(command.getCustomMessage())
                            .issuedAt(issuedAt)
                            .build())
                    .collect(Collectors.toList());
            notificationDispatcher.dispatchAll(invitations);

            metrics.recordVirtualCardsIssued(cards.size());
            metrics.recordOutcome("create_virtual_cards", "success", System.currentTimeMillis() - startTime);
            log.info("Issued {} virtual cards: issuer={}, parentPaymentMethodId={}, invitations={}",
                    cards.size(), issuer.getId(), parent.getId(), invitations.size());
            return cards;

        } catch (RuntimeException e) {
            metrics.recordOutcome("create_virtual_cards", "error", System.currentTimeMillis() - startTime);
            log.warn("Virtual card issuance failed: issuer={}, error={}", issuer.getId(), e.getMessage());
            throw e;
        }
    }

    /**
     * @return the number of cards the batch will contain
     */
    private int validateBatchShape(CreateVirtualCardsCommand command) {
        // a zero count means no count; an empty email list is still a list to match against
        if (command.getEmails() != null && command.hasCount()
                && command.getNumberOfVirtualCards() != command.getEmails().size()) {
            throw new ValidationException(ErrorCode.ARGUMENT_MISMATCH,
                    String.format("numberOfVirtualCards (%d) and the number of emails (%d) must match",
                            command.getNumberOfVirtualCards(), command.getEmails().size()),
                    Map.of("numberOfVirtualCards", String.valueOf(command.getNumberOfVirtualCards()),
                            "emails", String.valueOf(command.getEmails().size())));
        }
        if (command.isLimitedToOpenSourceCollectives() && command.getLimitedToHostCollectiveIds() != null
                && !command.getLimitedToHostCollectiveIds().isEmpty()) {
            throw new ValidationException(ErrorCode.ARGUMENT_CONFLICT,
                    "limitedToOpenSourceCollectives and limitedToHostCollectiveIds cannot be used together");
        }
        if (!command.hasEmails() && !command.hasCount()) {
            throw new ValidationException("Either emails or a positive numberOfVirtualCards is required");
        }
        int batchSize = command.hasEmails() ? command.getEmails().size() : command.getNumberOfVirtualCards();
        int maxBatchSize = properties.getVirtualCards().getMaxBatchSize();
        if (batchSize > maxBatchSize) {
            throw new ValidationException(String.format("Cannot issue %d virtual cards at once, the maximum is %d",
                    batchSize, maxBatchSize));
        }
        return batchSize;
    }

    private List<UUID> resolveHostLimit(CreateVirtualCardsCommand command) {
        if (!command.isLimitedToOpenSourceCollectives()) {
            return command.getLimitedToHostCollectiveIds();
        }
        UUID openSourceHostId = properties.getOpenSourceHostId();
        if (openSourceHostId == null || accountService.find(openSourceHostId).isEmpty()) {
            throw new ExternalDependencyException(ErrorCode.HOST_NOT_FOUND,
                    "Cannot find the host for open source collectives");
        }
        return List.of(openSourceHostId);
    }

    private PaymentMethodEntity resolveParent(CreateVirtualCardsCommand command, AccountEntity issuer) {
        if (command.getPaymentMethodId() == null) {
            return paymentMethodRepository.findActiveCreditCards(issuer.getId()).stream()
                    .findFirst()
                    .orElseThrow(() -> new ValidationException(
                            "No payment method given and " + issuer.getSlug() + " has no active credit card"));
        }
        PaymentMethodEntity parent = paymentMethodRepository.findById(command.getPaymentMethodId())
                .orElseThrow(() -> NotFoundException.of("PaymentMethod", command.getPaymentMethodId()));
        if (!issuer.getId().equals(parent.getAccountId()) || parent.isArchived()) {
            throw new ValidationException("Payment method " + parent.getId() + " cannot be used by " + issuer.getSlug());
        }
        return parent;
    }

    private static void requireBudget(CreateVirtualCardsCommand command) {
        BigDecimal amount = command.getAmount();
        BigDecimal monthlyLimit = command.getMonthlyLimitPerMember();
        if (amount == null && monthlyLimit == null) {
            throw new ValidationException("Either an amount or a monthlyLimitPerMember is required");
        }
        if ((amount != null && amount.signum() <= 0) || (monthlyLimit != null && monthlyLimit.signum() <= 0)) {
            throw ValidationException.invalidAmount("Virtual card amounts must be greater than 0");
        }
    }

    private static List<String> normalizedEmails(List<String> emails) {
        try {
            return emails.stream().map(AccountEntity::normalizeEmail).collect(Collectors.toList());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    private String uniqueClaimCode(Set<String> codesInBatch) {
        for (int attempt = 0; attempt < MAX_CLAIM_CODE_ATTEMPTS; attempt++) {
            String code = claimCodeGenerator.next();
            if (!codesInBatch.contains(code) && !paymentMethodRepository.existsByClaimCode(code)) {
                codesInBatch.add(code);
                return code;
            }
        }
        throw new IllegalStateException("Could not generate a unique claim code after " + MAX_CLAIM_CODE_ATTEMPTS + " attempts");
    }
}
