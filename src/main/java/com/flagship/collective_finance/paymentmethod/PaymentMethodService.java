package com.flagship.collective_finance.paymentmethod;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountService;
import com.flagship.collective_finance.auth.Action;
import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.AuthorizationTarget;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.error.AuthorizationException;
import com.flagship.collective_finance.error.DuplicateActionException;
import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.error.ExternalDependencyException;
import com.flagship.collective_finance.error.InvalidStateException;
import com.flagship.collective_finance.error.NotFoundException;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.observability.CorrelationContext;
import com.flagship.collective_finance.observability.MutationMetrics;
import com.flagship.collective_finance.order.OrderRepository;
import com.flagship.collective_finance.order.OrderStatus;
import com.flagship.collective_finance.order.SubscriptionRepository;
import com.flagship.collective_finance.order.SubscriptionStatus;
import com.flagship.collective_finance.processor.ExternalProcessorClient;
import com.flagship.collective_finance.processor.ProcessorRejectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Lifecycle of payment methods: creation, card registration, claiming,
 * edits and soft removal. Batch virtual-card issuance lives in
 * {@link VirtualCardService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentMethodService {

    private final PaymentMethodRepository paymentMethodRepository;
    private final OrderRepository orderRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final AccountService accountService;
    private final VirtualCardService virtualCardService;
    private final ExternalProcessorClient processorClient;
    private final AuthorizationGuard guard;
    private final MutationMetrics metrics;
    private final Clock clock;

    /**
     * Creates a payment method from caller-supplied attributes. Usage limits
     * are stored as given; they are enforced when the method is charged.
     * A VIRTUAL_CARD request mints a single unbound card instead.
     */
    @Transactional
    public PaymentMethodEntity createPaymentMethod(CreatePaymentMethodCommand command, Principal principal) {
        return tracked("create_payment_method", null, () -> {
            AccountEntity account = accountService.getRequired(command.getAccountId());
            guard.require(principal, Action.CREATE_PAYMENT_METHOD, AuthorizationTarget.account(account.getId()));

            if (command.getType() == null) {
                throw new ValidationException("Payment method type is required");
            }
            if (command.getCurrency() == null) {
                throw new ValidationException("Payment method currency is required");
            }
            if (command.getType() == PaymentMethodType.VIRTUAL_CARD) {
                return virtualCardService.createVirtualCards(CreateVirtualCardsCommand.builder()
                        .accountId(account.getId())
                        .paymentMethodId(command.getParentPaymentMethodId())
                        .numberOfVirtualCards(1)
                        .currency(command.getCurrency())
                        .amount(command.getInitialBalance())
                        .monthlyLimitPerMember(command.getMonthlyLimitPerMember())
                        .limitedToTags(command.getLimitedToTags())
                        .limitedToCollectiveIds(command.getLimitedToCollectiveIds())
                        .limitedToHostCollectiveIds(command.getLimitedToHostCollectiveIds())
                        .description(command.getDescription())
                        .expiryDate(command.getExpiryDate())
                        .build(), principal).get(0);
            }
            if (command.getType() == PaymentMethodType.CREDIT_CARD) {
                return registerCard(account, command.getName(), command.getToken(), command.getData(),
                        command.getMonthlyLimitPerMember(), principal);
            }

            PaymentMethodEntity paymentMethod = paymentMethodRepository.save(PaymentMethodEntity.from(NewPaymentMethod.builder()
                    .name(command.getName())
                    .description(command.getDescription())
                    .type(command.getType())
                    .provider(command.getProvider() != null ? command.getProvider() : PaymentProvider.INTERNAL)
                    .currency(command.getCurrency())
                    .accountId(account.getId())
                    .token(command.getToken())
                    .data(command.getData() == null ? Map.of() : command.getData())
                    .initialBalance(command.getInitialBalance())
                    .monthlyLimitPerMember(command.getMonthlyLimitPerMember())
                    .limitedToTags(command.getLimitedToTags())
                    .limitedToCollectiveIds(command.getLimitedToCollectiveIds())
                    .limitedToHostCollectiveIds(command.getLimitedToHostCollectiveIds())
                    .expiryDate(command.getExpiryDate())
                    .parentPaymentMethodId(command.getParentPaymentMethodId())
                    .createdByUserId(principal.getUserAccountId())
                    .build()));
            log.info("Payment method created: paymentMethodId={}, type={}, accountId={}",
                    paymentMethod.getId(), paymentMethod.getType(), account.getId());
            return paymentMethod;
        });
    }

    @Transactional
    public PaymentMethodEntity createCreditCard(CreateCreditCardCommand command, Principal principal) {
        return tracked("create_credit_card", null, () -> {
            AccountEntity account = accountService.getRequired(command.getAccountId());
            guard.require(principal, Action.CREATE_CREDIT_CARD, AuthorizationTarget.account(account.getId()));
            return registerCard(account, command.getName(), command.getToken(), command.getData(),
                    command.getMonthlyLimitPerMember(), principal);
        });
    }

    /**
     * Binds an unclaimed virtual card to the caller. An anonymous caller
     * claims on behalf of the user registered under {@code user.email},
     * which is created when it does not exist yet.
     */
    @Transactional
    public PaymentMethodEntity claimPaymentMethod(String code, ClaimingUser user, Principal principal) {
        return tracked("claim_payment_method", null, () -> {
            guard.require(principal, Action.CLAIM_PAYMENT_METHOD, AuthorizationTarget.none());
            if (code == null || code.isBlank()) {
                throw new ValidationException(ErrorCode.INVALID_CODE, "A claim code is required");
            }

            PaymentMethodEntity card = paymentMethodRepository.findByClaimCodeForUpdate(code.trim().toUpperCase())
                    .filter(pm -> pm.getType() == PaymentMethodType.VIRTUAL_CARD)
                    .orElseThrow(() -> new ValidationException(ErrorCode.INVALID_CODE, "Invalid claim code"));
            MDC.put(CorrelationContext.PAYMENT_METHOD_ID_MDC_KEY, card.getId().toString());

            if (card.isClaimed()) {
                throw new DuplicateActionException(ErrorCode.ALREADY_CLAIMED,
                        "Virtual card " + card.getId() + " has already been claimed");
            }
            if (card.isArchived() || card.isExpired(LocalDate.now(clock))) {
                throw new InvalidStateException("Virtual card " + card.getId() + " is no longer valid");
            }

            UUID claimant = resolveClaimant(user, principal);
            card.claim(claimant);
            PaymentMethodEntity claimed = paymentMethodRepository.save(card);
            log.info("Virtual card claimed: claimedBy={}", claimant);
            return claimed;
        });
    }

    @Transactional
    public PaymentMethodEntity updatePaymentMethod(Principal principal, UUID paymentMethodId, String name,
                                                   BigDecimal monthlyLimitPerMember) {
        return tracked("update_payment_method", paymentMethodId, () -> {
            PaymentMethodEntity paymentMethod = lock(paymentMethodId);
            guard.require(principal, Action.UPDATE_PAYMENT_METHOD, AuthorizationTarget.account(paymentMethod.getAccountId()));

            if (paymentMethod.isArchived()) {
                throw new InvalidStateException("Payment method " + paymentMethodId + " has been removed");
            }
            if (monthlyLimitPerMember != null && monthlyLimitPerMember.signum() <= 0) {
                throw ValidationException.invalidAmount("monthlyLimitPerMember must be greater than 0");
            }
            if (name != null) {
                paymentMethod.rename(name);
            }
            if (monthlyLimitPerMember != null) {
                paymentMethod.changeMonthlyLimit(monthlyLimitPerMember);
            }
            return paymentMethodRepository.save(paymentMethod);
        });
    }

    /**
     * Archives a payment method. Ledger rows keep referencing it.
     *
     * @throws InvalidStateException {@code in-use} while an open order or an
     *         active subscription still charges it
     */
    @Transactional
    public PaymentMethodEntity removePaymentMethod(Principal principal, UUID paymentMethodId) {
        return tracked("remove_payment_method", paymentMethodId, () -> {
            PaymentMethodEntity paymentMethod = lock(paymentMethodId);
            guard.require(principal, Action.REMOVE_PAYMENT_METHOD, AuthorizationTarget.account(paymentMethod.getAccountId()));

            boolean inUse = orderRepository.existsByPaymentMethodIdAndStatusIn(paymentMethodId,
                    List.of(OrderStatus.PENDING, OrderStatus.ACTIVE))
                    || subscriptionRepository.existsByPaymentMethodIdAndStatus(paymentMethodId, SubscriptionStatus.ACTIVE);
            if (inUse) {
                throw new InvalidStateException(ErrorCode.IN_USE,
                        "Payment method " + paymentMethodId + " is used by an open order or subscription");
            }
            paymentMethod.archive();
            log.info("Payment method removed");
            return paymentMethodRepository.save(paymentMethod);
        });
    }

    /**
     * Loads a payment method that {@code accountId} may charge.
     */
    @Transactional(readOnly = true)
    public PaymentMethodEntity requireUsableBy(UUID paymentMethodId, UUID accountId) {
        PaymentMethodEntity paymentMethod = paymentMethodRepository.findById(paymentMethodId)
                .orElseThrow(() -> NotFoundException.of("PaymentMethod", paymentMethodId));
        if (!paymentMethod.getAccountId().equals(accountId)) {
            throw new ValidationException("Payment method " + paymentMethodId + " does not belong to account " + accountId);
        }
        if (paymentMethod.isArchived()) {
            throw new ValidationException("Payment method " + paymentMethodId + " has been removed");
        }
        return paymentMethod;
    }

    private PaymentMethodEntity registerCard(AccountEntity account, String name, String token,
                                             Map<String, Object> data, BigDecimal monthlyLimitPerMember,
                                             Principal principal) {
        if (token == null || token.isBlank()) {
            throw new ValidationException("A processor token is required");
        }
        if (data == null || data.isEmpty()) {
            throw new ValidationException("Card data is required");
        }
        if (monthlyLimitPerMember != null && monthlyLimitPerMember.signum() <= 0) {
            throw ValidationException.invalidAmount("monthlyLimitPerMember must be greater than 0");
        }

        PaymentMethodEntity card = PaymentMethodEntity.from(NewPaymentMethod.builder()
                .name(name)
                .type(PaymentMethodType.CREDIT_CARD)
                .provider(PaymentProvider.EXTERNAL_PROCESSOR)
                .currency(account.getCurrency())
                .accountId(account.getId())
                .token(token)
                .data(data)
                .monthlyLimitPerMember(monthlyLimitPerMember)
                .createdByUserId(principal.getUserAccountId())
                .build());
        try {
            card.attachProcessorCustomer(processorClient.registerCard(token, data));
        } catch (ProcessorRejectedException e) {
            log.warn("Processor rejected card for account {}: {}", account.getId(), e.getMessage());
            throw new ExternalDependencyException("Payment processor rejected the card: " + e.getMessage(), e);
        }

        PaymentMethodEntity saved = paymentMethodRepository.save(card);
        log.info("Credit card registered: paymentMethodId={}, accountId={}", saved.getId(), account.getId());
        return saved;
    }

    private UUID resolveClaimant(ClaimingUser user, Principal principal) {
        if (principal.isAuthenticated()) {
            return principal.getUserAccountId();
        }
        if (user == null || user.getEmail() == null || user.getEmail().isBlank()) {
            throw new AuthorizationException(ErrorCode.UNAUTHENTICATED,
                    "An email is required to claim a virtual card without signing in");
        }
        return accountService.findOrCreateUser(user.getEmail(), user.getName()).getId();
    }

    private PaymentMethodEntity lock(UUID paymentMethodId) {
        return paymentMethodRepository.findByIdForUpdate(paymentMethodId)
                .orElseThrow(() -> NotFoundException.of("PaymentMethod", paymentMethodId));
    }

    private <T> T tracked(String operation, UUID paymentMethodId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        if (paymentMethodId != null) {
            MDC.put(CorrelationContext.PAYMENT_METHOD_ID_MDC_KEY, paymentMethodId.toString());
        }
        try {
            T result = action.get();
            metrics.recordOutcome(operation, "success", System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            metrics.recordOutcome(operation, "error", System.currentTimeMillis() - startTime);
            log.warn("{} failed: error={}", operation, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_METHOD_ID_MDC_KEY);
        }
    }
}
