package com.flagship.collective_finance.order;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountService;
import com.flagship.collective_finance.auth.Action;
import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.AuthorizationTarget;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.error.InsufficientFundsException;
import com.flagship.collective_finance.error.InvalidStateException;
import com.flagship.collective_finance.error.NotFoundException;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.ledger.LedgerService;
import com.flagship.collective_finance.ledger.LedgerTransactionEntity;
import com.flagship.collective_finance.ledger.TransactionRequest;
import com.flagship.collective_finance.ledger.TransactionType;
import com.flagship.collective_finance.observability.CorrelationContext;
import com.flagship.collective_finance.observability.MutationMetrics;
import com.flagship.collective_finance.paymentmethod.PaymentMethodService;
import com.flagship.collective_finance.processor.ChargeResult;
import com.flagship.collective_finance.processor.PaymentChargeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Order and subscription lifecycle.
 *
 * <p>Capturing an order charges its payment method and records one
 * CONTRIBUTION transaction crediting the destination, in the same unit of
 * work as the status change. When the payment method spends funds already
 * on the platform, the account owning those funds is debited by the same
 * amount in the same transaction group. A one-time order then becomes PAID; a recurring
 * one becomes ACTIVE with a subscription whose first period is already
 * charged. An order created without a payment method stays PENDING as a
 * pledge until {@link #completePledge} or {@link #markOrderAsPaid}.
 *
 * Submissions are not deduplicated: two identical createOrder calls create
 * two orders.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderService {

    private final OrderRepository orderRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final AccountService accountService;
    private final PaymentMethodService paymentMethodService;
    private final PaymentChargeService chargeService;
    private final LedgerService ledgerService;
    private final AuthorizationGuard guard;
    private final MutationMetrics metrics;
    private final Clock clock;

    @Transactional
    public OrderEntity createOrder(CreateOrderCommand command, Principal principal, String originIp) {
        return tracked("create_order", null, () -> {
            AccountEntity source = accountService.getRequired(command.getSourceAccountId());
            guard.require(principal, Action.CREATE_ORDER, AuthorizationTarget.account(source.getId()));

            requirePositive(command.getAmount());
            AccountEntity destination = accountService.getRequired(command.getDestinationAccountId());
            CurrencyCode currency = command.getCurrency() != null ? command.getCurrency() : destination.getCurrency();
            if (currency != destination.getCurrency()) {
                throw new ValidationException(String.format("Order currency %s does not match %s's currency %s",
                        currency, destination.getSlug(), destination.getCurrency()));
            }
            OrderInterval interval = command.getInterval() != null ? command.getInterval() : OrderInterval.NONE;
            if (interval.isRecurring() && command.getPaymentMethodId() == null) {
                throw new ValidationException("A recurring contribution requires a payment method");
            }
            if (command.getPaymentMethodId() != null) {
                paymentMethodService.requireUsableBy(command.getPaymentMethodId(), source.getId());
            }

            OrderEntity order = orderRepository.save(OrderEntity.place(
                    command.getAmount(), currency, source.getId(), destination.getId(), interval,
                    command.getPaymentMethodId(), command.getPublicMessage(), command.getDescription(),
                    originIp, principal.getUserAccountId()));
            MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, order.getId().toString());

            if (order.getPaymentMethodId() == null) {
                log.info("Pledge recorded: amount={} {}, destination={}", order.getAmount(), currency, destination.getId());
                return order;
            }
            capture(order, destination, principal);
            log.info("Order created: status={}, amount={} {}, interval={}",
                    order.getStatus(), order.getAmount(), currency, interval);
            return order;
        });
    }

    /**
     * Supplies payment for a pledge and captures it.
     *
     * @throws InvalidStateException if the order is not a PENDING pledge
     */
    @Transactional
    public OrderEntity completePledge(Principal principal, UUID orderId, UUID paymentMethodId) {
        return tracked("complete_pledge", orderId, () -> {
            OrderEntity order = lockOrder(orderId);
            guard.require(principal, Action.COMPLETE_PLEDGE,
                    AuthorizationTarget.ownedBy(order.getSourceAccountId(), order.getCreatedByUserId()));

            if (!order.isPledge()) {
                throw new InvalidStateException("Order " + orderId + " is " + order.getStatus() + ", not a pending pledge");
            }
            if (paymentMethodId == null) {
                throw new ValidationException("A payment method is required to complete a pledge");
            }
            paymentMethodService.requireUsableBy(paymentMethodId, order.getSourceAccountId());
            order.attachPaymentMethod(paymentMethodId);

            capture(order, accountService.getRequired(order.getDestinationAccountId()), principal);
            log.info("Pledge completed: status={}", order.getStatus());
            return order;
        });
    }

    /**
     * Host confirmation that a pledge was paid outside the platform, for
     * instance by bank transfer. Records the contribution without charging
     * anything.
     */
    @Transactional
    public OrderEntity markOrderAsPaid(Principal principal, UUID orderId) {
        return tracked("mark_order_paid", orderId, () -> {
            OrderEntity order = lockOrder(orderId);
            guard.require(principal, Action.MARK_ORDER_PAID, AuthorizationTarget.account(order.getDestinationAccountId()));

            if (!order.isPledge()) {
                throw new InvalidStateException("Order " + orderId + " is " + order.getStatus() + ", not a pending pledge");
            }
            recordContribution(order, null, null, principal, "Offline payment for order " + order.getId());
            order.transitionTo(OrderStatus.PAID);
            log.info("Order marked as paid by host administrator {}", principal.getUserAccountId());
            return order;
        });
    }

    @Transactional
    public OrderEntity updateOrderInfo(Principal principal, UUID orderId, String publicMessage) {
        return tracked("update_order_info", orderId, () -> {
            OrderEntity order = orderRepository.findById(orderId)
                    .orElseThrow(() -> NotFoundException.of("Order", orderId));
            guard.require(principal, Action.UPDATE_ORDER_INFO,
                    AuthorizationTarget.ownedBy(order.getSourceAccountId(), order.getCreatedByUserId()));
            order.updatePublicMessage(publicMessage);
            return order;
        });
    }

    /**
     * Stops future charges of the subscription behind {@code orderId}.
     * Transactions already recorded are left as they are.
     */
    @Transactional
    public SubscriptionEntity cancelSubscription(Principal principal, UUID orderId) {
        return tracked("cancel_subscription", orderId, () -> {
            OrderEntity order = lockOrder(orderId);
            guard.require(principal, Action.CANCEL_SUBSCRIPTION,
                    AuthorizationTarget.ownedBy(order.getSourceAccountId(), order.getCreatedByUserId()));

            SubscriptionEntity subscription = subscriptionOf(order);
            if (!subscription.isActive()) {
                throw new InvalidStateException("Subscription of order " + orderId + " is already cancelled");
            }
            subscription.cancel();
            order.transitionTo(OrderStatus.CANCELLED);
            log.info("Subscription cancelled: subscriptionId={}", subscription.getId());
            return subscription;
        });
    }

    /**
     * Changes the amount and/or payment method used for future charges.
     *
     * @throws ValidationException {@code invalid-amount} when amount is not positive
     */
    @Transactional
    public SubscriptionEntity updateSubscription(Principal principal, UpdateSubscriptionCommand command) {
        if (command.getAmount() != null) {
            requirePositive(command.getAmount());
        }
        return tracked("update_subscription", command.getOrderId(), () -> {
            OrderEntity order = lockOrder(command.getOrderId());
            guard.require(principal, Action.UPDATE_SUBSCRIPTION,
                    AuthorizationTarget.ownedBy(order.getSourceAccountId(), order.getCreatedByUserId()));

            SubscriptionEntity subscription = subscriptionOf(order);
            if (!subscription.isActive()) {
                throw new InvalidStateException("Subscription of order " + order.getId() + " is cancelled");
            }
            if (command.getPaymentMethodId() != null) {
                paymentMethodService.requireUsableBy(command.getPaymentMethodId(), order.getSourceAccountId());
                subscription.changePaymentMethod(command.getPaymentMethodId());
                order.attachPaymentMethod(command.getPaymentMethodId());
            }
            if (command.getAmount() != null) {
                subscription.changeAmount(command.getAmount());
            }
            log.info("Subscription updated: amount={}, paymentMethodId={}",
                    subscription.getAmount(), subscription.getPaymentMethodId());
            return subscription;
        });
    }

    @Transactional(readOnly = true)
    public SubscriptionEntity findSubscription(UUID orderId) {
        return subscriptionRepository.findByOrderId(orderId)
                .orElseThrow(() -> new NotFoundException("No subscription for order " + orderId));
    }

    private void capture(OrderEntity order, AccountEntity destination, Principal principal) {
        String description = order.getDescription() != null
                ? order.getDescription()
                : "Contribution to " + destination.getName();
        ChargeResult charge = chargeService.charge(order.getPaymentMethodId(), destination,
                order.getAmount(), order.getCurrency(), order.getId(), description);
        if (charge.isDrawnFromAccountBalance()) {
            recordInternalContribution(order, charge.getFundingAccountId(), principal, description);
        } else {
            recordContribution(order, order.getPaymentMethodId(), charge.getProcessorChargeId(), principal, description);
        }

        if (order.getInterval().isRecurring()) {
            SubscriptionEntity subscription = SubscriptionEntity.start(order, order.getPaymentMethodId());
            subscription.recordCharge(LocalDate.now(clock));
            subscriptionRepository.save(subscription);
            order.attachSubscription(subscription.getId());
            order.transitionTo(OrderStatus.ACTIVE);
        } else {
            order.transitionTo(OrderStatus.PAID);
        }
    }

    private LedgerTransactionEntity recordContribution(OrderEntity order, UUID paymentMethodId, String chargeId,
                                                       Principal principal, String description) {
        return ledgerService.record(contributionLeg(order, principal, description)
                .paymentMethodId(paymentMethodId)
                .processorChargeId(chargeId)
                .build());
    }

    /**
     * Funds spent from the platform leave the balance of the account that
     * owns the funding method, which is the order's source unless the method
     * is a card claimed from another account. That account is locked, must
     * cover the amount, and is debited in the same group as the credit.
     */
    private void recordInternalContribution(OrderEntity order, UUID fundingAccountId, Principal principal,
                                            String description) {
        accountService.lockForDebit(fundingAccountId);
        BigDecimal available = ledgerService.balanceOf(fundingAccountId);
        if (available.compareTo(order.getAmount()) < 0) {
            throw new InsufficientFundsException(fundingAccountId, available, order.getAmount());
        }
        UUID group = UUID.randomUUID();
        ledgerService.recordAll(List.of(
                contributionLeg(order, principal, description)
                        .paymentMethodId(order.getPaymentMethodId())
                        .transactionGroup(group)
                        .build(),
                TransactionRequest.builder()
                        .type(TransactionType.CONTRIBUTION)
                        .accountId(fundingAccountId)
                        .counterpartyAccountId(order.getDestinationAccountId())
                        .amount(order.getAmount().negate())
                        .currency(order.getCurrency())
                        .orderId(order.getId())
                        .transactionGroup(group)
                        .description(description)
                        .createdByUserId(principal.getUserAccountId())
                        .build()));
    }

    private TransactionRequest.TransactionRequestBuilder contributionLeg(OrderEntity order, Principal principal,
                                                                         String description) {
        return TransactionRequest.builder()
                .type(TransactionType.CONTRIBUTION)
                .accountId(order.getDestinationAccountId())
                .counterpartyAccountId(order.getSourceAccountId())
                .amount(order.getAmount())
                .currency(order.getCurrency())
                .orderId(order.getId())
                .description(description)
                .createdByUserId(principal.getUserAccountId());
    }

    private OrderEntity lockOrder(UUID orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> NotFoundException.of("Order", orderId));
    }

    private SubscriptionEntity subscriptionOf(OrderEntity order) {
        return subscriptionRepository.findByOrderId(order.getId())
                .orElseThrow(() -> new NotFoundException("No subscription for order " + order.getId()));
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw ValidationException.invalidAmount("Amount must be greater than 0");
        }
    }

    private <T> T tracked(String operation, UUID orderId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        if (orderId != null) {
            MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, orderId.toString());
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
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }
}
