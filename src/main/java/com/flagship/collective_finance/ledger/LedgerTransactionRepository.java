package com.flagship.collective_finance.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransactionEntity, UUID> {

    /**
     * Locks the row so that concurrent refunds of the same transaction
     * serialize on it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM LedgerTransactionEntity t WHERE t.id = :id")
    Optional<LedgerTransactionEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByRefundOfTransactionId(UUID refundOfTransactionId);

    List<LedgerTransactionEntity> findByTransactionGroupOrderByCreatedAtAsc(UUID transactionGroup);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransactionEntity t WHERE t.accountId = :accountId")
    BigDecimal sumAmountByAccountId(@Param("accountId") UUID accountId);

    /**
     * Net amount charged to the given payment methods: contributions minus
     * their refunds.
     */
    @Query("""
        SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransactionEntity t
        WHERE t.paymentMethodId IN :paymentMethodIds
          AND t.type IN (com.flagship.collective_finance.ledger.TransactionType.CONTRIBUTION,
                         com.flagship.collective_finance.ledger.TransactionType.REFUND)
        """)
    BigDecimal sumChargedByPaymentMethods(@Param("paymentMethodIds") Collection<UUID> paymentMethodIds);

    @Query("""
        SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransactionEntity t
        WHERE t.paymentMethodId IN :paymentMethodIds
          AND t.type IN (com.flagship.collective_finance.ledger.TransactionType.CONTRIBUTION,
                         com.flagship.collective_finance.ledger.TransactionType.REFUND)
          AND t.createdAt >= :since
        """)
    BigDecimal sumChargedByPaymentMethodsSince(@Param("paymentMethodIds") Collection<UUID> paymentMethodIds,
                                               @Param("since") Instant since);
}
