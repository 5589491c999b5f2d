package com.flagship.collective_finance.expense;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.common.FeeBreakdown;
import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.error.InvalidStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpenseTest {

    private Expense pending() {
        return Expense.submit(UUID.randomUUID(), UUID.randomUUID(), new BigDecimal("100.00"), CurrencyCode.USD,
                "Conference tickets", null);
    }

    @Test
    @DisplayName("A submitted expense is pending with no fees")
    void submit_NewExpense_IsPendingWithoutFees() {
        Expense expense = pending();

        assertThat(expense.getStatus()).isEqualTo(ExpenseStatus.PENDING);
        assertThat(expense.getFees().total()).isEqualByComparingTo("0");
        assertThat(expense.isEditable()).isTrue();
    }

    @Test
    @DisplayName("Approve then pay walks the happy path and records the fees")
    void pay_AfterApproval_IsPaidWithFees() {
        // Given
        FeeBreakdown fees = FeeBreakdown.of(new BigDecimal("2.90"), new BigDecimal("5.00"), null);

        // When
        Expense paid = pending().approve().pay(fees);

        // Then
        assertThat(paid.getStatus()).isEqualTo(ExpenseStatus.PAID);
        assertThat(paid.getFees()).isEqualTo(fees);
        assertThat(paid.netPayout(fees)).isEqualByComparingTo("92.10");
        assertThat(paid.isEditable()).isFalse();
    }

    @Test
    @DisplayName("A pending expense cannot be paid")
    void pay_FromPending_ThrowsInvalidTransition() {
        Expense expense = pending();

        assertThatThrownBy(() -> expense.pay(FeeBreakdown.none()))
                .isInstanceOf(InvalidStateException.class)
                .extracting(e -> ((InvalidStateException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_TRANSITION);
    }

    @Test
    @DisplayName("A rejected expense cannot be approved afterwards")
    void approve_AfterRejection_ThrowsInvalidTransition() {
        Expense rejected = pending().reject();

        assertThatThrownBy(rejected::approve).isInstanceOf(InvalidStateException.class);
    }

    @ParameterizedTest
    @EnumSource(value = ExpenseStatus.class, names = {"REJECTED", "PAID"})
    @DisplayName("Rejected and paid are terminal")
    void isAllowed_FromFinalState_FalseForEveryTarget(ExpenseStatus status) {
        for (ExpenseStatus target : ExpenseStatus.values()) {
            assertThat(ExpenseStateTransitions.isAllowed(status, target)).isFalse();
        }
    }

    @Test
    @DisplayName("Transitions are one-directional")
    void isAllowed_Backwards_False() {
        assertThat(ExpenseStateTransitions.isAllowed(ExpenseStatus.APPROVED, ExpenseStatus.PENDING)).isFalse();
        assertThat(ExpenseStateTransitions.isAllowed(ExpenseStatus.PAID, ExpenseStatus.APPROVED)).isFalse();
        assertThat(ExpenseStateTransitions.isAllowed(ExpenseStatus.PENDING, ExpenseStatus.PAID)).isFalse();
    }
}
