package com.flagship.collective_finance.ledger;

import com.flagship.collective_finance.auth.Action;
import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.AuthorizationTarget;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.error.DuplicateActionException;
import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.error.InvalidStateException;
import com.flagship.collective_finance.error.NotFoundException;
import com.flagship.collective_finance.observability.CorrelationContext;
import com.flagship.collective_finance.observability.MutationMetrics;
import com.flagship.collective_finance.processor.PaymentChargeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Reverses contributions and expense payments.
 *
 * <p>A refund is a new REFUND transaction with the negated amount and fees,
 * linked to the original, which is never modified. The original row is
 * locked before the "already refunded" check so that two concurrent refunds
 * of the same transaction serialize; the unique constraint on
 * {@code refund_of_transaction_id} backs this up at the database.
 *
 * <p>The refund rows are flushed before the payment processor is asked to
 * give money back, so a rejected insert never leaves an external refund
 * without its ledger entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefundService {

    private final LedgerTransactionRepository repository;
    private final LedgerService ledgerService;
    private final PaymentChargeService chargeService;
    private final AuthorizationGuard guard;
    private final MutationMetrics metrics;

    /**
     * @throws NotFoundException if the transaction does not exist
     * @throws com.flagship.collective_finance.error.AuthorizationException
     *         unless the caller administers the payer or the recipient
     * @throws DuplicateActionException {@code already-refunded}
     * @throws InvalidStateException for refunds and fund transfers
     */
    @Transactional
    public LedgerTransactionEntity refundTransaction(Principal principal, UUID transactionId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());

        try {
            LedgerTransactionEntity original = repository.findByIdForUpdate(transactionId)
                    .orElseThrow(() -> NotFoundException.of("Transaction", transactionId));

            guard.require(principal, Action.REFUND_TRANSACTION,
                    AuthorizationTarget.between(original.getAccountId(), original.getCounterpartyAccountId()));

            if (original.getType() == TransactionType.REFUND) {
                throw new InvalidStateException("Transaction " + transactionId + " is itself a refund");
            }
            if (original.getType() == TransactionType.FUND_TRANSFER) {
                throw new InvalidStateException("Fund transfers cannot be refunded");
            }
            List<LedgerTransactionEntity> legs = legsOf(original);
            for (LedgerTransactionEntity leg : legs) {
                if (repository.existsByRefundOfTransactionId(leg.getId())) {
                    throw new DuplicateActionException(ErrorCode.ALREADY_REFUNDED,
                            "Transaction " + leg.getId() + " has already been refunded");
                }
            }

            LedgerTransactionEntity refund = null;
            for (LedgerTransactionEntity leg : legs) {
                LedgerTransactionEntity reversal = ledgerService.record(reversalOf(leg, principal));
                if (leg.getId().equals(original.getId())) {
                    refund = reversal;
                }
            }
            // constraint violations surface here, before any money goes back out
            repository.flush();
            for (LedgerTransactionEntity leg : legs) {
                chargeService.refundCharge(leg);
            }

            metrics.recordOutcome("refund_transaction", "success", System.currentTimeMillis() - startTime);
            log.info("Refunded transaction: refundId={}, amount={} {}",
                    refund.getId(), refund.getAmount(), refund.getCurrency());
            return refund;

        } catch (RuntimeException e) {
            metrics.recordOutcome("refund_transaction", "error", System.currentTimeMillis() - startTime);
            log.warn("Refund failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * A contribution spent from platform funds has a debit leg on the payer
     * next to its credit; refunding either one reverses both.
     */
    private List<LedgerTransactionEntity> legsOf(LedgerTransactionEntity original) {
        if (original.getType() != TransactionType.CONTRIBUTION
                || original.getTransactionGroup().equals(original.getId())) {
            return List.of(original);
        }
        List<LedgerTransactionEntity> legs = new ArrayList<>();
        for (LedgerTransactionEntity sibling : repository.findByTransactionGroupOrderByCreatedAtAsc(original.getTransactionGroup())) {
            if (sibling.getType() != TransactionType.CONTRIBUTION) {
                continue;
            }
            legs.add(sibling.getId().equals(original.getId())
                    ? original
                    : repository.findByIdForUpdate(sibling.getId())
                            .orElseThrow(() -> NotFoundException.of("Transaction", sibling.getId())));
        }
        return legs;
    }

    private static TransactionRequest reversalOf(LedgerTransactionEntity leg, Principal principal) {
        return TransactionRequest.builder()
                .type(TransactionType.REFUND)
                .accountId(leg.getAccountId())
                .counterpartyAccountId(leg.getCounterpartyAccountId())
                .amount(leg.getAmount().negate())
                .currency(leg.getCurrency())
                .fees(leg.getFees().negate())
                .orderId(leg.getOrderId())
                .expenseId(leg.getExpenseId())
                .paymentMethodId(leg.getType() == TransactionType.CONTRIBUTION ? leg.getPaymentMethodId() : null)
                .refundOfTransactionId(leg.getId())
                .transactionGroup(leg.getTransactionGroup())
                .processorChargeId(leg.getProcessorChargeId())
                .description("Refund of " + (leg.getDescription() != null
                        ? leg.getDescription() : "transaction " + leg.getId()))
                .createdByUserId(principal.getUserAccountId())
                .build();
    }
}
