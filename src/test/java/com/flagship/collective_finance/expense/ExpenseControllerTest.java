package com.flagship.collective_finance.expense;

import com.flagship.collective_finance.api.RemoteUserArgumentResolver;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.common.FeeBreakdown;
import com.flagship.collective_finance.error.InvalidStateException;
import com.flagship.collective_finance.observability.CorrelationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ExpenseController.class)
class ExpenseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExpenseService expenseService;

    private final UUID userId = UUID.randomUUID();
    private final UUID accountId = UUID.randomUUID();

    private Expense pendingExpense() {
        return Expense.submit(accountId, userId, new BigDecimal("100.00"), CurrencyCode.USD, "Hosting invoice", null);
    }

    @Test
    @DisplayName("POST /api/expenses submits on behalf of the remote user and returns 201")
    void createExpense_ValidBody_Returns201() throws Exception {
        // Given
        Expense expense = pendingExpense();
        when(expenseService.createExpense(eq(Principal.user(userId)), any(ExpenseDraft.class))).thenReturn(expense);

        // When / Then
        mockMvc.perform(post("/api/expenses")
                        .header(RemoteUserArgumentResolver.REMOTE_USER_HEADER, userId.toString())
                        .header(CorrelationContext.CORRELATION_ID_HEADER, "corr-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"account_id": "%s", "amount": 100.00, "currency": "USD", "description": "Hosting invoice"}
                                """.formatted(accountId)))
                .andExpect(status().isCreated())
                .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "corr-123"))
                .andExpect(jsonPath("$.id").value(expense.getId().toString()))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.submitted_by_user_id").value(userId.toString()));

        ArgumentCaptor<ExpenseDraft> draft = ArgumentCaptor.forClass(ExpenseDraft.class);
        verify(expenseService).createExpense(eq(Principal.user(userId)), draft.capture());
        assertThat(draft.getValue().getAccountId()).isEqualTo(accountId);
        assertThat(draft.getValue().getCurrency()).isEqualTo(CurrencyCode.USD);
        assertThat(draft.getValue().getAmount()).isEqualByComparingTo("100.00");
    }

    @Test
    @DisplayName("A zero amount fails bean validation with the field in the details")
    void createExpense_ZeroAmount_Returns400() throws Exception {
        mockMvc.perform(post("/api/expenses")
                        .header(RemoteUserArgumentResolver.REMOTE_USER_HEADER, userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"account_id": "%s", "amount": 0, "description": "Nothing"}
                                """.formatted(accountId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation"))
                .andExpect(jsonPath("$.details.amount").exists());

        verifyNoInteractions(expenseService);
    }

    @Test
    @DisplayName("A malformed remote user header is unauthenticated")
    void createExpense_MalformedUserHeader_Returns401() throws Exception {
        mockMvc.perform(post("/api/expenses")
                        .header(RemoteUserArgumentResolver.REMOTE_USER_HEADER, "not-a-uuid")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"account_id": "%s", "amount": 10, "description": "Stickers"}
                                """.formatted(accountId)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("unauthenticated"));

        verifyNoInteractions(expenseService);
    }

    @Test
    @DisplayName("Paying without a body pays with no fees")
    void payExpense_NoBody_PaysWithoutFees() throws Exception {
        // Given
        Expense paid = pendingExpense().approve().pay(FeeBreakdown.none());
        when(expenseService.payExpense(Principal.user(userId), paid.getId(), FeeBreakdown.none())).thenReturn(paid);

        // When / Then
        mockMvc.perform(post("/api/expenses/{id}/pay", paid.getId())
                        .header(RemoteUserArgumentResolver.REMOTE_USER_HEADER, userId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAID"));
    }

    @Test
    @DisplayName("Paying an expense that is not approved maps to 409 invalid-transition")
    void payExpense_NotApproved_Returns409() throws Exception {
        // Given
        UUID expenseId = UUID.randomUUID();
        when(expenseService.payExpense(eq(Principal.user(userId)), eq(expenseId), any()))
                .thenThrow(InvalidStateException.invalidTransition(ExpenseStatus.PENDING, ExpenseStatus.PAID,
                        "expense " + expenseId));

        // When / Then
        mockMvc.perform(post("/api/expenses/{id}/pay", expenseId)
                        .header(RemoteUserArgumentResolver.REMOTE_USER_HEADER, userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"processor_fee": 1.50, "host_fee": 5.00}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("invalid-transition"))
                .andExpect(jsonPath("$.retryable").value(false));
    }
}
