package com.flagship.collective_finance.expense;

import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.common.FeeBreakdown;
import com.flagship.collective_finance.expense.dto.ExpenseRequest;
import com.flagship.collective_finance.expense.dto.ExpenseResponse;
import com.flagship.collective_finance.expense.dto.PayExpenseRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;

    @PostMapping
    public ResponseEntity<ExpenseResponse> createExpense(@Valid @RequestBody ExpenseRequest request, Principal principal) {
        Expense expense = expenseService.createExpense(principal, toDraft(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expense));
    }

    @GetMapping("/{id}")
    public ExpenseResponse getExpense(@PathVariable("id") UUID id) {
        return ExpenseResponse.from(expenseService.getExpense(id));
    }

    @PutMapping("/{id}")
    public ExpenseResponse editExpense(@PathVariable("id") UUID id, @Valid @RequestBody ExpenseRequest request,
                                       Principal principal) {
        return ExpenseResponse.from(expenseService.editExpense(principal, id, toDraft(request)));
    }

    @DeleteMapping("/{id}")
    public ExpenseResponse deleteExpense(@PathVariable("id") UUID id, Principal principal) {
        return ExpenseResponse.from(expenseService.deleteExpense(principal, id));
    }

    @PostMapping("/{id}/approve")
    public ExpenseResponse approveExpense(@PathVariable("id") UUID id, Principal principal) {
        return ExpenseResponse.from(expenseService.updateExpenseStatus(principal, id, ExpenseStatus.APPROVED));
    }

    @PostMapping("/{id}/reject")
    public ExpenseResponse rejectExpense(@PathVariable("id") UUID id, Principal principal) {
        return ExpenseResponse.from(expenseService.updateExpenseStatus(principal, id, ExpenseStatus.REJECTED));
    }

    /**
     * Pays an approved expense. The body is optional; omitted fees are zero.
     */
    @PostMapping("/{id}/pay")
    public ExpenseResponse payExpense(@PathVariable("id") UUID id,
                                      @Valid @RequestBody(required = false) PayExpenseRequest request,
                                      Principal principal) {
        FeeBreakdown fees = request == null
                ? FeeBreakdown.none()
                : FeeBreakdown.of(request.getProcessorFee(), request.getHostFee(), request.getPlatformFee());
        return ExpenseResponse.from(expenseService.payExpense(principal, id, fees));
    }

    private static ExpenseDraft toDraft(ExpenseRequest request) {
        return ExpenseDraft.builder()
                .accountId(request.getAccountId())
                .amount(request.getAmount())
                .currency(request.getCurrency() == null ? null : CurrencyCode.parse(request.getCurrency()))
                .description(request.getDescription())
                .attachmentUrl(request.getAttachmentUrl())
                .build();
    }
}
