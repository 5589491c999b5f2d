package com.flagship.collective_finance.ledger;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.observability.MutationMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    @Mock
    private LedgerTransactionRepository repository;

    @Mock
    private MutationMetrics metrics;

    @InjectMocks
    private LedgerService ledgerService;

    @Test
    @DisplayName("A contribution without a group gets its own id as group")
    void record_Contribution_SavesWithOwnGroup() {
        // Given
        when(repository.save(any(LedgerTransactionEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        LedgerTransactionEntity saved = ledgerService.record(TransactionRequest.builder()
                .type(TransactionType.CONTRIBUTION)
                .accountId(UUID.randomUUID())
                .amount(new BigDecimal("25.00"))
                .currency(CurrencyCode.EUR)
                .build());

        // Then
        assertThat(saved.getTransactionGroup()).isEqualTo(saved.getId());
        assertThat(saved.getFees().total()).isEqualByComparingTo("0");
        verify(metrics).recordTransaction("CONTRIBUTION", "EUR");
    }

    @Test
    @DisplayName("A debit recorded as a contribution is refused before anything is saved")
    void record_NegativeContribution_ThrowsIllegalArgument() {
        TransactionRequest request = TransactionRequest.builder()
                .type(TransactionType.CONTRIBUTION)
                .accountId(UUID.randomUUID())
                .amount(new BigDecimal("-25.00"))
                .currency(CurrencyCode.USD)
                .build();

        assertThatThrownBy(() -> ledgerService.record(request)).isInstanceOf(IllegalArgumentException.class);
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("A contribution debit carrying the payment method is rejected even inside a group")
    void record_GroupedDebitWithPaymentMethod_ThrowsIllegalArgument() {
        TransactionRequest request = TransactionRequest.builder()
                .type(TransactionType.CONTRIBUTION)
                .accountId(UUID.randomUUID())
                .amount(new BigDecimal("-25.00"))
                .currency(CurrencyCode.USD)
                .transactionGroup(UUID.randomUUID())
                .paymentMethodId(UUID.randomUUID())
                .build();

        assertThatThrownBy(() -> ledgerService.record(request)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("The paying leg of an internally funded contribution is accepted")
    void record_GroupedDebitWithoutPaymentMethod_Saved() {
        // Given
        when(repository.save(any(LedgerTransactionEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        UUID group = UUID.randomUUID();
        TransactionRequest request = TransactionRequest.builder()
                .type(TransactionType.CONTRIBUTION)
                .accountId(UUID.randomUUID())
                .amount(new BigDecimal("-25.00"))
                .currency(CurrencyCode.USD)
                .transactionGroup(group)
                .build();

        // When
        LedgerTransactionEntity saved = ledgerService.record(request);

        // Then
        assertThat(saved.getAmount()).isEqualByComparingTo("-25.00");
        assertThat(saved.getTransactionGroup()).isEqualTo(group);
    }

    @Test
    @DisplayName("Only refunds may point at another transaction")
    void record_ContributionWithRefundLink_ThrowsIllegalArgument() {
        TransactionRequest request = TransactionRequest.builder()
                .type(TransactionType.CONTRIBUTION)
                .accountId(UUID.randomUUID())
                .amount(BigDecimal.TEN)
                .currency(CurrencyCode.USD)
                .refundOfTransactionId(UUID.randomUUID())
                .build();

        assertThatThrownBy(() -> ledgerService.record(request)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Fund transfer legs keep the shared group")
    void recordAll_TransferLegs_ShareGroup() {
        // Given
        when(repository.save(any(LedgerTransactionEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        UUID group = UUID.randomUUID();
        TransactionRequest credit = TransactionRequest.builder()
                .type(TransactionType.FUND_TRANSFER).accountId(UUID.randomUUID())
                .amount(new BigDecimal("300.00")).currency(CurrencyCode.USD).transactionGroup(group).build();
        TransactionRequest debit = TransactionRequest.builder()
                .type(TransactionType.FUND_TRANSFER).accountId(UUID.randomUUID())
                .amount(new BigDecimal("-300.00")).currency(CurrencyCode.USD).transactionGroup(group).build();

        // When
        List<LedgerTransactionEntity> legs = ledgerService.recordAll(List.of(credit, debit));

        // Then
        assertThat(legs).extracting(LedgerTransactionEntity::getTransactionGroup).containsOnly(group);
        assertThat(legs).extracting(LedgerTransactionEntity::getAmount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("300.00"), new BigDecimal("-300.00"));
    }
}
