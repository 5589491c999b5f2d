package com.flagship.collective_finance.expense;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExpenseRepository extends JpaRepository<ExpenseEntity, UUID> {

    /**
     * Row lock held for the rest of the unit of work; concurrent payments of
     * the same expense wait here and then see the first one's result.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM ExpenseEntity e WHERE e.id = :id")
    Optional<ExpenseEntity> findByIdForUpdate(@Param("id") UUID id);

    long countByStatus(ExpenseStatus status);
}
