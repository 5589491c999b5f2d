package com.flagship.collective_finance.expense;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountService;
import com.flagship.collective_finance.auth.Action;
import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.AuthorizationTarget;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.common.FeeBreakdown;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Expense submission, review and payout.
 *
 * <p>Every state-changing method locks the expense row first, so two
 * reviewers acting on the same expense serialize and the second one sees
 * the first one's outcome. {@link #payExpense} checks the state, validates
 * the fees, checks the balance, records the ledger transaction and marks the
 * expense PAID in one unit of work; any failure leaves status and fees as
 * they were.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    private final ExpenseRepository expenseRepository;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final AuthorizationGuard guard;
    private final MutationMetrics metrics;

    @Transactional
    public Expense createExpense(Principal principal, ExpenseDraft draft) {
        long startTime = System.currentTimeMillis();
        guard.require(principal, Action.CREATE_EXPENSE, AuthorizationTarget.none());
        try {
            AccountEntity account = accountService.getRequired(draft.getAccountId());
            requirePositive(draft.getAmount());
            if (draft.getDescription() == null || draft.getDescription().isBlank()) {
                throw new ValidationException("An expense needs a description");
            }
            CurrencyCode currency = draft.getCurrency() != null ? draft.getCurrency() : account.getCurrency();
            requireAccountCurrency(account, currency);

            Expense expense = Expense.submit(account.getId(), principal.getUserAccountId(), draft.getAmount(),
                    currency, draft.getDescription().trim(), draft.getAttachmentUrl());
            Expense saved = expenseRepository.save(ExpenseEntity.fromDomain(expense)).toDomain();

            metrics.recordOutcome("create_expense", "success", System.currentTimeMillis() - startTime);
            log.info("Expense submitted: expenseId={}, accountId={}, amount={} {}",
                    saved.getId(), saved.getAccountId(), saved.getAmount(), saved.getCurrency());
            return saved;
        } catch (RuntimeException e) {
            metrics.recordOutcome("create_expense", "error", System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    /**
     * Edits a PENDING expense. Null fields of the draft are left unchanged.
     */
    @Transactional
    public Expense editExpense(Principal principal, UUID expenseId, ExpenseDraft draft) {
        return withExpense("edit_expense", expenseId, () -> {
            ExpenseEntity entity = lock(expenseId);
            guard.require(principal, Action.EDIT_EXPENSE,
                    AuthorizationTarget.ownedBy(entity.getAccountId(), entity.getSubmittedByUserId()));

            Expense expense = entity.toDomain();
            if (!expense.isEditable()) {
                throw new InvalidStateException("Expense " + expenseId + " is " + expense.getStatus()
                        + " and can no longer be edited");
            }
            if (draft.getAccountId() != null && !draft.getAccountId().equals(expense.getAccountId())) {
                throw new ValidationException("An expense cannot be moved to another account");
            }
            if (draft.getCurrency() != null && draft.getCurrency() != expense.getCurrency()) {
                throw new ValidationException("Expense currency cannot be changed");
            }
            if (draft.getAmount() != null) {
                requirePositive(draft.getAmount());
                expense = expense.withAmount(draft.getAmount());
            }
            if (draft.getDescription() != null) {
                if (draft.getDescription().isBlank()) {
                    throw new ValidationException("An expense needs a description");
                }
                expense = expense.withDescription(draft.getDescription().trim());
            }
            if (draft.getAttachmentUrl() != null) {
                expense = expense.withAttachmentUrl(draft.getAttachmentUrl());
            }
            entity.updateFromDomain(expense);
            return expenseRepository.save(entity).toDomain();
        });
    }

    @Transactional
    public Expense deleteExpense(Principal principal, UUID expenseId) {
        return withExpense("delete_expense", expenseId, () -> {
            ExpenseEntity entity = lock(expenseId);
            guard.require(principal, Action.DELETE_EXPENSE,
                    AuthorizationTarget.ownedBy(entity.getAccountId(), entity.getSubmittedByUserId()));

            if (entity.getStatus() != ExpenseStatus.PENDING) {
                throw new InvalidStateException("Only pending expenses can be deleted; expense "
                        + expenseId + " is " + entity.getStatus());
            }
            Expense deleted = entity.toDomain();
            expenseRepository.delete(entity);
            log.info("Expense deleted");
            return deleted;
        });
    }

    /**
     * Approves or rejects a PENDING expense.
     *
     * @throws ValidationException for any target status other than APPROVED or REJECTED
     * @throws InvalidStateException {@code invalid-transition} from any other source state
     */
    @Transactional
    public Expense updateExpenseStatus(Principal principal, UUID expenseId, ExpenseStatus newStatus) {
        if (newStatus != ExpenseStatus.APPROVED && newStatus != ExpenseStatus.REJECTED) {
            throw new ValidationException("Expense status can only be set to APPROVED or REJECTED, got " + newStatus);
        }
        return withExpense(newStatus == ExpenseStatus.APPROVED ? "approve_expense" : "reject_expense", expenseId, () -> {
            ExpenseEntity entity = lock(expenseId);
            guard.require(principal,
                    newStatus == ExpenseStatus.APPROVED ? Action.APPROVE_EXPENSE : Action.REJECT_EXPENSE,
                    AuthorizationTarget.account(entity.getAccountId()));

            Expense updated = entity.toDomain().transitionTo(newStatus);
            entity.updateFromDomain(updated);
            log.info("Expense {}", newStatus);
            return expenseRepository.save(entity).toDomain();
        });
    }

    /**
     * Pays an APPROVED expense out of its account's funds.
     *
     * <p>The caller supplies the fee breakdown; the ledger records one
     * EXPENSE_PAYMENT transaction of {@code -(amount - fees)} on the owning
     * account, carrying the fees.
     *
     * @throws InvalidStateException {@code invalid-transition} unless APPROVED
     * @throws ValidationException when a fee is negative or fees reach the amount
     * @throws InsufficientFundsException when the account balance is below the expense amount
     */
    @Transactional
    public Expense payExpense(Principal principal, UUID expenseId, FeeBreakdown fees) {
        return withExpense("pay_expense", expenseId, () -> {
            ExpenseEntity entity = lock(expenseId);
            guard.require(principal, Action.PAY_EXPENSE, AuthorizationTarget.account(entity.getAccountId()));

            Expense expense = entity.toDomain();
            if (expense.getStatus() != ExpenseStatus.APPROVED) {
                throw InvalidStateException.invalidTransition(expense.getStatus(), ExpenseStatus.PAID, "expense " + expenseId);
            }

            FeeBreakdown appliedFees = fees == null ? FeeBreakdown.none() : fees;
            if (appliedFees.hasNegativeComponent()) {
                throw new ValidationException("Fees cannot be negative");
            }
            if (appliedFees.total().compareTo(expense.getAmount()) >= 0) {
                throw new ValidationException("Fees (" + appliedFees.total() + ") must be lower than the expense amount ("
                        + expense.getAmount() + ")");
            }

            accountService.lockForDebit(expense.getAccountId());
            BigDecimal balance = ledgerService.balanceOf(expense.getAccountId());
            if (balance.compareTo(expense.getAmount()) < 0) {
                throw new InsufficientFundsException(expense.getAccountId(), balance, expense.getAmount());
            }

            BigDecimal netPayout = expense.netPayout(appliedFees);
            LedgerTransactionEntity transaction = ledgerService.record(TransactionRequest.builder()
                    .type(TransactionType.EXPENSE_PAYMENT)
                    .accountId(expense.getAccountId())
                    .counterpartyAccountId(expense.getSubmittedByUserId())
                    .amount(netPayout.negate())
                    .currency(expense.getCurrency())
                    .fees(appliedFees)
                    .expenseId(expense.getId())
                    .description(expense.getDescription())
                    .createdByUserId(principal.getUserAccountId())
                    .build());

            Expense paid = expense.pay(appliedFees);
            entity.updateFromDomain(paid);
            entity.setLedgerTransactionId(transaction.getId());
            ExpenseEntity saved = expenseRepository.save(entity);

            log.info("Expense paid: transactionId={}, netPayout={} {}, fees={}",
                    transaction.getId(), netPayout, expense.getCurrency(), appliedFees.total());
            return saved.toDomain();
        });
    }

    @Transactional(readOnly = true)
    public Expense getExpense(UUID expenseId) {
        return expenseRepository.findById(expenseId)
                .map(ExpenseEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Expense", expenseId));
    }

    private ExpenseEntity lock(UUID expenseId) {
        return expenseRepository.findByIdForUpdate(expenseId)
                .orElseThrow(() -> NotFoundException.of("Expense", expenseId));
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw ValidationException.invalidAmount("Expense amount must be greater than 0");
        }
    }

    private static void requireAccountCurrency(AccountEntity account, CurrencyCode currency) {
        if (currency != account.getCurrency()) {
            throw new ValidationException(String.format("Expense currency %s does not match %s's currency %s",
                    currency, account.getSlug(), account.getCurrency()));
        }
    }

    private Expense withExpense(String operation, UUID expenseId, Supplier<Expense> action) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.EXPENSE_ID_MDC_KEY, expenseId.toString());
        try {
            Expense result = action.get();
            metrics.recordOutcome(operation, "success", System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            metrics.recordOutcome(operation, "error", System.currentTimeMillis() - startTime);
            log.warn("{} failed: error={}", operation, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.EXPENSE_ID_MDC_KEY);
        }
    }
}
