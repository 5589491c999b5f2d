package com.flagship.collective_finance.processor;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountType;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.error.InsufficientFundsException;
import com.flagship.collective_finance.error.InvalidStateException;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.ledger.LedgerService;
import com.flagship.collective_finance.paymentmethod.NewPaymentMethod;
import com.flagship.collective_finance.paymentmethod.PaymentMethodEntity;
import com.flagship.collective_finance.paymentmethod.PaymentMethodRepository;
import com.flagship.collective_finance.paymentmethod.PaymentMethodType;
import com.flagship.collective_finance.paymentmethod.PaymentProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UsageConstraintEvaluatorTest {

    @Mock
    private LedgerService ledgerService;

    @Mock
    private PaymentMethodRepository paymentMethodRepository;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC);
    private UsageConstraintEvaluator evaluator;

    private final UUID hostId = UUID.randomUUID();
    private AccountEntity webpack;

    @BeforeEach
    void setUp() {
        evaluator = new UsageConstraintEvaluator(ledgerService, paymentMethodRepository, clock);
        webpack = AccountEntity.hosted("Webpack", AccountType.COLLECTIVE, CurrencyCode.USD, hostId, false,
                List.of("open source", "javascript"));
    }

    private NewPaymentMethod.NewPaymentMethodBuilder card() {
        return NewPaymentMethod.builder()
                .name("Gift card")
                .type(PaymentMethodType.VIRTUAL_CARD)
                .provider(PaymentProvider.INTERNAL)
                .currency(CurrencyCode.USD)
                .accountId(UUID.randomUUID());
    }

    @Test
    @DisplayName("An unrestricted method with no budget never touches the ledger")
    void check_NoLimits_Passes() {
        PaymentMethodEntity unrestricted = PaymentMethodEntity.from(card().build());

        assertThatCode(() -> evaluator.check(unrestricted, webpack, new BigDecimal("1000.00"), CurrencyCode.USD))
                .doesNotThrowAnyException();
        verifyNoInteractions(ledgerService);
    }

    @Test
    @DisplayName("An expired method is refused")
    void check_Expired_ThrowsInvalidState() {
        PaymentMethodEntity expired = PaymentMethodEntity.from(card().expiryDate(LocalDate.of(2026, 3, 14)).build());

        assertThatThrownBy(() -> evaluator.check(expired, webpack, BigDecimal.TEN, CurrencyCode.USD))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    @DisplayName("A charge in another currency is refused")
    void check_CurrencyMismatch_ThrowsValidation() {
        PaymentMethodEntity usd = PaymentMethodEntity.from(card().build());

        assertThatThrownBy(() -> evaluator.check(usd, webpack, BigDecimal.TEN, CurrencyCode.EUR))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Collective, host and tag restrictions each reject a non-matching destination")
    void check_Restrictions_RejectOutsiders() {
        PaymentMethodEntity collectiveOnly = PaymentMethodEntity.from(card()
                .limitedToCollectiveIds(List.of(UUID.randomUUID())).build());
        PaymentMethodEntity hostOnly = PaymentMethodEntity.from(card()
                .limitedToHostCollectiveIds(List.of(UUID.randomUUID())).build());
        PaymentMethodEntity taggedOnly = PaymentMethodEntity.from(card()
                .limitedToTags(List.of("climate")).build());

        assertThatThrownBy(() -> evaluator.check(collectiveOnly, webpack, BigDecimal.TEN, CurrencyCode.USD))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> evaluator.check(hostOnly, webpack, BigDecimal.TEN, CurrencyCode.USD))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> evaluator.check(taggedOnly, webpack, BigDecimal.TEN, CurrencyCode.USD))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Matching restrictions pass")
    void check_MatchingRestrictions_Passes() {
        PaymentMethodEntity restricted = PaymentMethodEntity.from(card()
                .limitedToCollectiveIds(List.of(webpack.getId()))
                .limitedToHostCollectiveIds(List.of(hostId))
                .limitedToTags(List.of("javascript"))
                .build());

        assertThatCode(() -> evaluator.check(restricted, webpack, BigDecimal.TEN, CurrencyCode.USD))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("The monthly limit counts charges since the first of the month")
    void check_MonthlyLimitReached_ThrowsInsufficientFunds() {
        // Given
        PaymentMethodEntity limited = PaymentMethodEntity.from(card().monthlyLimitPerMember(new BigDecimal("100.00")).build());
        when(ledgerService.chargedThroughSince(anyCollection(), any(Instant.class))).thenReturn(new BigDecimal("80.00"));

        // When / Then
        assertThatThrownBy(() -> evaluator.check(limited, webpack, new BigDecimal("20.01"), CurrencyCode.USD))
                .isInstanceOf(InsufficientFundsException.class);
        verify(ledgerService).chargedThroughSince(anyCollection(), eq(
                Instant.parse("2026-03-01T00:00:00Z")));
    }

    @Test
    @DisplayName("The remaining balance includes what cards minted from the method have spent")
    void check_BalanceSpentByChildren_ThrowsInsufficientFunds() {
        // Given
        PaymentMethodEntity parent = PaymentMethodEntity.from(card().initialBalance(new BigDecimal("100.00")).build());
        UUID childId = UUID.randomUUID();
        when(paymentMethodRepository.findIdsByParentPaymentMethodId(parent.getId())).thenReturn(List.of(childId));
        when(paymentMethodRepository.findIdsByParentPaymentMethodId(childId)).thenReturn(List.of());
        when(ledgerService.chargedThrough(anyCollection())).thenReturn(new BigDecimal("95.00"));

        // When / Then
        assertThatThrownBy(() -> evaluator.check(parent, webpack, new BigDecimal("10.00"), CurrencyCode.USD))
                .isInstanceOf(InsufficientFundsException.class);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<UUID>> consumers = ArgumentCaptor.forClass(Collection.class);
        verify(ledgerService).chargedThrough(consumers.capture());
        assertThat(consumers.getValue()).containsExactlyInAnyOrder(parent.getId(), childId);
    }
}
