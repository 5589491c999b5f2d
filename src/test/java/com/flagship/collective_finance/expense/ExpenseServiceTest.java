package com.flagship.collective_finance.expense;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountService;
import com.flagship.collective_finance.account.AccountType;
import com.flagship.collective_finance.auth.Action;
import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.AuthorizationTarget;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.common.FeeBreakdown;
import com.flagship.collective_finance.error.AuthorizationException;
import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.error.InsufficientFundsException;
import com.flagship.collective_finance.error.InvalidStateException;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.ledger.LedgerService;
import com.flagship.collective_finance.ledger.LedgerTransactionEntity;
import com.flagship.collective_finance.ledger.TransactionRequest;
import com.flagship.collective_finance.ledger.TransactionType;
import com.flagship.collective_finance.observability.MutationMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpenseServiceTest {

    @Mock
    private ExpenseRepository expenseRepository;

    @Mock
    private AccountService accountService;

    @Mock
    private LedgerService ledgerService;

    @Mock
    private AuthorizationGuard guard;

    @Mock
    private MutationMetrics metrics;

    @InjectMocks
    private ExpenseService expenseService;

    private final UUID submitterId = UUID.randomUUID();
    private final UUID hostAdminId = UUID.randomUUID();
    private AccountEntity collective;

    @BeforeEach
    void setUp() {
        collective = AccountEntity.hosted("Webpack", AccountType.COLLECTIVE, CurrencyCode.USD,
                UUID.randomUUID(), false, List.of("open source"));
        lenient().when(expenseRepository.save(any(ExpenseEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private ExpenseEntity stored(Expense expense) {
        ExpenseEntity entity = ExpenseEntity.fromDomain(expense);
        when(expenseRepository.findByIdForUpdate(expense.getId())).thenReturn(Optional.of(entity));
        return entity;
    }

    private Expense submitted() {
        return Expense.submit(collective.getId(), submitterId, new BigDecimal("100.00"), CurrencyCode.USD,
                "Hosting invoice", "https://example.org/invoice.pdf");
    }

    @Nested
    @DisplayName("createExpense")
    class CreateExpense {

        @Test
        @DisplayName("Submits a pending expense in the account's currency")
        void createExpense_ValidDraft_SavesPending() {
            // Given
            when(accountService.getRequired(collective.getId())).thenReturn(collective);
            ExpenseDraft draft = ExpenseDraft.builder()
                    .accountId(collective.getId())
                    .amount(new BigDecimal("42.50"))
                    .description("Stickers")
                    .build();

            // When
            Expense created = expenseService.createExpense(Principal.user(submitterId), draft);

            // Then
            assertThat(created.getStatus()).isEqualTo(ExpenseStatus.PENDING);
            assertThat(created.getCurrency()).isEqualTo(CurrencyCode.USD);
            assertThat(created.getSubmittedByUserId()).isEqualTo(submitterId);
            verify(guard).require(Principal.user(submitterId), Action.CREATE_EXPENSE, AuthorizationTarget.none());
        }

        @Test
        @DisplayName("Rejects a currency other than the account's")
        void createExpense_CurrencyMismatch_ThrowsValidation() {
            // Given
            when(accountService.getRequired(collective.getId())).thenReturn(collective);
            ExpenseDraft draft = ExpenseDraft.builder()
                    .accountId(collective.getId())
                    .amount(new BigDecimal("10.00"))
                    .currency(CurrencyCode.EUR)
                    .description("Train ticket")
                    .build();

            // When / Then
            assertThatThrownBy(() -> expenseService.createExpense(Principal.user(submitterId), draft))
                    .isInstanceOf(ValidationException.class);
            verify(expenseRepository, never()).save(any());
        }

        @Test
        @DisplayName("Rejects a non-positive amount as invalid-amount")
        void createExpense_ZeroAmount_ThrowsInvalidAmount() {
            // Given
            when(accountService.getRequired(collective.getId())).thenReturn(collective);
            ExpenseDraft draft = ExpenseDraft.builder()
                    .accountId(collective.getId())
                    .amount(BigDecimal.ZERO)
                    .description("Nothing")
                    .build();

            // When / Then
            assertThatThrownBy(() -> expenseService.createExpense(Principal.user(submitterId), draft))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_AMOUNT);
        }
    }

    @Nested
    @DisplayName("editExpense and deleteExpense")
    class EditAndDelete {

        @Test
        @DisplayName("Edits only the fields present in the draft")
        void editExpense_Pending_UpdatesGivenFields() {
            // Given
            Expense expense = submitted();
            ExpenseEntity entity = stored(expense);

            // When
            Expense edited = expenseService.editExpense(Principal.user(submitterId), expense.getId(),
                    ExpenseDraft.builder().amount(new BigDecimal("120.00")).build());

            // Then
            assertThat(edited.getAmount()).isEqualByComparingTo("120.00");
            assertThat(edited.getDescription()).isEqualTo("Hosting invoice");
            assertThat(entity.getAmount()).isEqualByComparingTo("120.00");
            verify(guard).require(Principal.user(submitterId), Action.EDIT_EXPENSE,
                    AuthorizationTarget.ownedBy(collective.getId(), submitterId));
        }

        @Test
        @DisplayName("An approved expense can no longer be edited")
        void editExpense_Approved_ThrowsInvalidState() {
            // Given
            Expense approved = submitted().approve();
            stored(approved);

            // When / Then
            assertThatThrownBy(() -> expenseService.editExpense(Principal.user(submitterId), approved.getId(),
                    ExpenseDraft.builder().description("Changed").build()))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("Another user cannot delete the expense")
        void deleteExpense_NotOwner_PropagatesDenial() {
            // Given
            Expense expense = submitted();
            stored(expense);
            Principal stranger = Principal.user(UUID.randomUUID());
            doThrow(new AuthorizationException(ErrorCode.NOT_OWNER, "denied"))
                    .when(guard).require(eq(stranger), eq(Action.DELETE_EXPENSE), any());

            // When / Then
            assertThatThrownBy(() -> expenseService.deleteExpense(stranger, expense.getId()))
                    .isInstanceOf(AuthorizationException.class);
            verify(expenseRepository, never()).delete(any());
        }

        @Test
        @DisplayName("Deletes a pending expense")
        void deleteExpense_Pending_Deletes() {
            // Given
            Expense expense = submitted();
            ExpenseEntity entity = stored(expense);

            // When
            expenseService.deleteExpense(Principal.user(submitterId), expense.getId());

            // Then
            verify(expenseRepository).delete(entity);
        }
    }

    @Nested
    @DisplayName("updateExpenseStatus")
    class UpdateStatus {

        @Test
        @DisplayName("Approves a pending expense")
        void updateExpenseStatus_PendingToApproved_Approves() {
            // Given
            Expense expense = submitted();
            ExpenseEntity entity = stored(expense);

            // When
            Expense approved = expenseService.updateExpenseStatus(Principal.user(hostAdminId), expense.getId(),
                    ExpenseStatus.APPROVED);

            // Then
            assertThat(approved.getStatus()).isEqualTo(ExpenseStatus.APPROVED);
            assertThat(entity.getStatus()).isEqualTo(ExpenseStatus.APPROVED);
            verify(guard).require(Principal.user(hostAdminId), Action.APPROVE_EXPENSE,
                    AuthorizationTarget.account(collective.getId()));
        }

        @Test
        @DisplayName("Rejecting an already rejected expense is an invalid transition")
        void updateExpenseStatus_RejectedToRejected_ThrowsInvalidTransition() {
            // Given
            Expense rejected = submitted().reject();
            stored(rejected);

            // When / Then
            assertThatThrownBy(() -> expenseService.updateExpenseStatus(Principal.user(hostAdminId), rejected.getId(),
                    ExpenseStatus.REJECTED))
                    .isInstanceOf(InvalidStateException.class)
                    .extracting(e -> ((InvalidStateException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_TRANSITION);
        }

        @Test
        @DisplayName("PAID cannot be set through a status update")
        void updateExpenseStatus_TargetPaid_ThrowsValidation() {
            assertThatThrownBy(() -> expenseService.updateExpenseStatus(Principal.user(hostAdminId), UUID.randomUUID(),
                    ExpenseStatus.PAID))
                    .isInstanceOf(ValidationException.class);
            verify(expenseRepository, never()).findByIdForUpdate(any());
        }
    }

    @Nested
    @DisplayName("payExpense")
    class PayExpense {

        @Test
        @DisplayName("Records the net payout with its fees and marks the expense paid")
        void payExpense_Approved_RecordsNetPayout() {
            // Given
            Expense approved = submitted().approve();
            ExpenseEntity entity = stored(approved);
            FeeBreakdown fees = FeeBreakdown.of(new BigDecimal("2.90"), new BigDecimal("5.00"), BigDecimal.ZERO);
            UUID transactionId = UUID.randomUUID();
            LedgerTransactionEntity transaction = mock(LedgerTransactionEntity.class);
            when(transaction.getId()).thenReturn(transactionId);
            when(ledgerService.balanceOf(collective.getId())).thenReturn(new BigDecimal("500.00"));
            when(ledgerService.record(any(TransactionRequest.class))).thenReturn(transaction);

            // When
            Expense paid = expenseService.payExpense(Principal.user(hostAdminId), approved.getId(), fees);

            // Then
            ArgumentCaptor<TransactionRequest> request = ArgumentCaptor.forClass(TransactionRequest.class);
            verify(ledgerService).record(request.capture());
            assertThat(request.getValue().getType()).isEqualTo(TransactionType.EXPENSE_PAYMENT);
            assertThat(request.getValue().getAccountId()).isEqualTo(collective.getId());
            assertThat(request.getValue().getAmount()).isEqualByComparingTo("-92.10");
            assertThat(request.getValue().getFees()).isEqualTo(fees);
            assertThat(request.getValue().getExpenseId()).isEqualTo(approved.getId());

            assertThat(paid.getStatus()).isEqualTo(ExpenseStatus.PAID);
            assertThat(entity.getLedgerTransactionId()).isEqualTo(transactionId);
            assertThat(entity.getHostFee()).isEqualByComparingTo("5.00");
            verify(accountService).lockForDebit(collective.getId());
        }

        @Test
        @DisplayName("Paying a pending expense fails and leaves the fees untouched")
        void payExpense_Pending_ThrowsInvalidTransition() {
            // Given
            Expense expense = submitted();
            ExpenseEntity entity = stored(expense);

            // When / Then
            assertThatThrownBy(() -> expenseService.payExpense(Principal.user(hostAdminId), expense.getId(),
                    FeeBreakdown.of(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE)))
                    .isInstanceOf(InvalidStateException.class)
                    .extracting(e -> ((InvalidStateException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_TRANSITION);
            assertThat(entity.getStatus()).isEqualTo(ExpenseStatus.PENDING);
            assertThat(entity.getProcessorFee()).isEqualByComparingTo("0");
            verify(ledgerService, never()).record(any());
        }

        @Test
        @DisplayName("Paying twice fails the second time")
        void payExpense_AlreadyPaid_ThrowsInvalidTransition() {
            // Given
            Expense paid = submitted().approve().pay(FeeBreakdown.none());
            stored(paid);

            // When / Then
            assertThatThrownBy(() -> expenseService.payExpense(Principal.user(hostAdminId), paid.getId(), FeeBreakdown.none()))
                    .isInstanceOf(InvalidStateException.class);
            verify(ledgerService, never()).record(any());
        }

        @Test
        @DisplayName("Fees reaching the expense amount are rejected")
        void payExpense_FeesCoverWholeAmount_ThrowsValidation() {
            // Given
            Expense approved = submitted().approve();
            stored(approved);

            // When / Then
            assertThatThrownBy(() -> expenseService.payExpense(Principal.user(hostAdminId), approved.getId(),
                    FeeBreakdown.of(new BigDecimal("60.00"), new BigDecimal("40.00"), null)))
                    .isInstanceOf(ValidationException.class);
            verify(ledgerService, never()).record(any());
        }

        @Test
        @DisplayName("Negative fees are rejected")
        void payExpense_NegativeFee_ThrowsValidation() {
            // Given
            Expense approved = submitted().approve();
            stored(approved);

            // When / Then
            assertThatThrownBy(() -> expenseService.payExpense(Principal.user(hostAdminId), approved.getId(),
                    FeeBreakdown.of(new BigDecimal("-1.00"), null, null)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("An account balance below the expense amount fails with insufficient-funds")
        void payExpense_BalanceTooLow_ThrowsInsufficientFunds() {
            // Given
            Expense approved = submitted().approve();
            ExpenseEntity entity = stored(approved);
            when(ledgerService.balanceOf(collective.getId())).thenReturn(new BigDecimal("99.99"));

            // When / Then
            assertThatThrownBy(() -> expenseService.payExpense(Principal.user(hostAdminId), approved.getId(),
                    FeeBreakdown.none()))
                    .isInstanceOf(InsufficientFundsException.class);
            assertThat(entity.getStatus()).isEqualTo(ExpenseStatus.APPROVED);
            verify(ledgerService, never()).record(any());
        }
    }
}
