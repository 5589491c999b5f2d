package com.flagship.collective_finance.ledger;

import com.flagship.collective_finance.error.NotFoundException;
import com.flagship.collective_finance.observability.MutationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * The only writer of ledger transactions.
 *
 * Invariants:
 * 1. Transactions are append-only; nothing here updates or deletes a row
 * 2. Recording always joins the caller's unit of work (MANDATORY), so a
 *    transaction exists only if the entity change it realizes commits too
 * 3. Balances are the signed sum of an account's transactions, never a
 *    stored counter
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerTransactionRepository repository;
    private final MutationMetrics metrics;

    /**
     * Records one transaction.
     *
     * @throws IllegalArgumentException if the request breaks the sign or
     *         linkage rules of its type
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerTransactionEntity record(TransactionRequest request) {
        request.validate();
        LedgerTransactionEntity saved = repository.save(LedgerTransactionEntity.fromRequest(request));
        metrics.recordTransaction(saved.getType().name(), saved.getCurrency().name());

        log.info("Recorded {} transaction: transactionId={}, accountId={}, amount={} {}",
                saved.getType(), saved.getId(), saved.getAccountId(), saved.getAmount(), saved.getCurrency());
        return saved;
    }

    /**
     * Records several legs of one movement of funds under a shared group id.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<LedgerTransactionEntity> recordAll(List<TransactionRequest> legs) {
        return legs.stream().map(this::record).toList();
    }

    @Transactional(readOnly = true)
    public BigDecimal balanceOf(UUID accountId) {
        return repository.sumAmountByAccountId(accountId);
    }

    /**
     * Net amount charged through the given payment methods.
     */
    @Transactional(readOnly = true)
    public BigDecimal chargedThrough(Collection<UUID> paymentMethodIds) {
        return repository.sumChargedByPaymentMethods(paymentMethodIds);
    }

    @Transactional(readOnly = true)
    public BigDecimal chargedThroughSince(Collection<UUID> paymentMethodIds, Instant since) {
        return repository.sumChargedByPaymentMethodsSince(paymentMethodIds, since);
    }

    @Transactional(readOnly = true)
    public LedgerTransactionEntity getRequired(UUID transactionId) {
        return repository.findById(transactionId)
                .orElseThrow(() -> NotFoundException.of("Transaction", transactionId));
    }
}
