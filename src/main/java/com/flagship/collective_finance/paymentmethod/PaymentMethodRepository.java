package com.flagship.collective_finance.paymentmethod;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentMethodRepository extends JpaRepository<PaymentMethodEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT pm FROM PaymentMethodEntity pm WHERE pm.id = :id")
    Optional<PaymentMethodEntity> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT pm FROM PaymentMethodEntity pm WHERE pm.claimCode = :claimCode")
    Optional<PaymentMethodEntity> findByClaimCodeForUpdate(@Param("claimCode") String claimCode);

    boolean existsByClaimCode(String claimCode);

    @Query("SELECT pm.id FROM PaymentMethodEntity pm WHERE pm.parentPaymentMethodId = :parentId")
    List<UUID> findIdsByParentPaymentMethodId(@Param("parentId") UUID parentId);

    /**
     * The MANUAL allocation a host has already funded for an account, if any.
     */
    @Query("""
        SELECT pm FROM PaymentMethodEntity pm
        WHERE pm.accountId = :accountId
          AND pm.type = com.flagship.collective_finance.paymentmethod.PaymentMethodType.MANUAL
          AND pm.archivedAt IS NULL
          AND pm.issuerAccountId = :accountId
        ORDER BY pm.createdAt ASC
        """)
    List<PaymentMethodEntity> findActiveManualAllocations(@Param("accountId") UUID accountId);

    @Query("""
        SELECT pm FROM PaymentMethodEntity pm
        WHERE pm.accountId = :accountId
          AND pm.type = com.flagship.collective_finance.paymentmethod.PaymentMethodType.CREDIT_CARD
          AND pm.archivedAt IS NULL
        ORDER BY pm.createdAt DESC
        """)
    List<PaymentMethodEntity> findActiveCreditCards(@Param("accountId") UUID accountId);
}
