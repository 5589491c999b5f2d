package com.flagship.collective_finance.paymentmethod;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountService;
import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.config.FinanceProperties;
import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.error.ExternalDependencyException;
import com.flagship.collective_finance.error.MutationException;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.notification.NotificationDispatcher;
import com.flagship.collective_finance.notification.VirtualCardInvitationNotification;
import com.flagship.collective_finance.observability.MutationMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VirtualCardServiceTest {

    @Mock
    private PaymentMethodRepository paymentMethodRepository;

    @Mock
    private AccountService accountService;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    @Mock
    private ClaimCodeGenerator claimCodeGenerator;

    @Mock
    private AuthorizationGuard guard;

    @Mock
    private MutationMetrics metrics;

    private final FinanceProperties properties = new FinanceProperties();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final Principal orgAdmin = Principal.user(UUID.randomUUID());

    private VirtualCardService virtualCardService;
    private AccountEntity issuer;
    private PaymentMethodEntity creditCard;

    @BeforeEach
    void setUp() {
        virtualCardService = new VirtualCardService(paymentMethodRepository, accountService, notificationDispatcher,
                claimCodeGenerator, guard, properties, metrics, clock);
        issuer = AccountEntity.organization("Acme Corp", null, CurrencyCode.USD);
        creditCard = PaymentMethodEntity.from(NewPaymentMethod.builder()
                .name("Corporate Visa")
                .type(PaymentMethodType.CREDIT_CARD)
                .provider(PaymentProvider.EXTERNAL_PROCESSOR)
                .currency(CurrencyCode.USD)
                .accountId(issuer.getId())
                .token("tok_visa")
                .build());
        when(accountService.getRequired(issuer.getId())).thenReturn(issuer);
    }

    private CreateVirtualCardsCommand.CreateVirtualCardsCommandBuilder batch() {
        return CreateVirtualCardsCommand.builder()
                .accountId(issuer.getId())
                .amount(new BigDecimal("50.00"));
    }

    @Test
    @DisplayName("Three emails with a count of five is an argument mismatch and nothing is saved")
    void createVirtualCards_EmailCountMismatch_ThrowsArgumentMismatch() {
        // Given
        CreateVirtualCardsCommand command = batch()
                .emails(List.of("a@example.org", "b@example.org", "c@example.org"))
                .numberOfVirtualCards(5)
                .build();

        // When / Then
        assertThatThrownBy(() -> virtualCardService.createVirtualCards(command, orgAdmin))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> {
                    MutationException error = (MutationException) e;
                    assertThat(error.getErrorCode()).isEqualTo(ErrorCode.ARGUMENT_MISMATCH);
                    assertThat(error.getDetails()).containsEntry("numberOfVirtualCards", "5")
                            .containsEntry("emails", "3");
                });
        verify(paymentMethodRepository, never()).saveAll(anyList());
        verify(notificationDispatcher, never()).dispatchAll(anyList());
    }

    @Test
    @DisplayName("An empty email list with a count of five is an argument mismatch, not five unbound cards")
    void createVirtualCards_EmptyEmailsWithCount_ThrowsArgumentMismatch() {
        // Given
        CreateVirtualCardsCommand command = batch().emails(List.of()).numberOfVirtualCards(5).build();

        // When / Then
        assertThatThrownBy(() -> virtualCardService.createVirtualCards(command, orgAdmin))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((MutationException) e).getDetails())
                        .containsEntry("numberOfVirtualCards", "5")
                        .containsEntry("emails", "0"))
                .extracting(e -> ((MutationException) e).getErrorCode())
                .isEqualTo(ErrorCode.ARGUMENT_MISMATCH);
        verify(paymentMethodRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("A count of zero next to emails is ignored and one card is minted per email")
    void createVirtualCards_ZeroCountWithEmails_UsesEmails() {
        // Given
        when(paymentMethodRepository.findActiveCreditCards(issuer.getId())).thenReturn(List.of(creditCard));
        when(claimCodeGenerator.next()).thenReturn("EEEE6666");
        when(paymentMethodRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
        CreateVirtualCardsCommand command = batch()
                .emails(List.of("carol@example.org"))
                .numberOfVirtualCards(0)
                .build();

        // When
        List<PaymentMethodEntity> cards = virtualCardService.createVirtualCards(command, orgAdmin);

        // Then
        assertThat(cards).extracting(PaymentMethodEntity::getRecipientEmail).containsExactly("carol@example.org");
        verify(metrics).recordVirtualCardsIssued(1);
    }

    @Test
    @DisplayName("Open-source restriction and explicit hosts together are an argument conflict")
    void createVirtualCards_OpenSourceWithHosts_ThrowsArgumentConflict() {
        // Given
        CreateVirtualCardsCommand command = batch()
                .numberOfVirtualCards(2)
                .limitedToOpenSourceCollectives(true)
                .limitedToHostCollectiveIds(List.of(UUID.randomUUID()))
                .build();

        // When / Then
        assertThatThrownBy(() -> virtualCardService.createVirtualCards(command, orgAdmin))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((MutationException) e).getErrorCode())
                .isEqualTo(ErrorCode.ARGUMENT_CONFLICT);
    }

    @Test
    @DisplayName("Neither emails nor a count is a validation error")
    void createVirtualCards_NoEmailsNoCount_ThrowsValidation() {
        assertThatThrownBy(() -> virtualCardService.createVirtualCards(batch().build(), orgAdmin))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Open-source restriction without a configured host is host-not-found")
    void createVirtualCards_OpenSourceHostMissing_ThrowsHostNotFound() {
        // Given
        UUID openSourceHostId = UUID.randomUUID();
        properties.setOpenSourceHostId(openSourceHostId);
        when(accountService.find(openSourceHostId)).thenReturn(Optional.empty());
        CreateVirtualCardsCommand command = batch().numberOfVirtualCards(1).limitedToOpenSourceCollectives(true).build();

        // When / Then
        assertThatThrownBy(() -> virtualCardService.createVirtualCards(command, orgAdmin))
                .isInstanceOf(ExternalDependencyException.class)
                .extracting(e -> ((MutationException) e).getErrorCode())
                .isEqualTo(ErrorCode.HOST_NOT_FOUND);
        verify(paymentMethodRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("Two emails mint two invited cards, saved before the invitations are queued")
    void createVirtualCards_TwoEmails_SavesThenInvites() {
        // Given
        when(paymentMethodRepository.findActiveCreditCards(issuer.getId())).thenReturn(List.of(creditCard));
        when(claimCodeGenerator.next()).thenReturn("AAAA2222", "BBBB3333");
        when(paymentMethodRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
        CreateVirtualCardsCommand command = batch()
                .emails(List.of(" Alice@Example.org", "bob@example.org"))
                .customMessage("Thanks for contributing")
                .build();

        // When
        List<PaymentMethodEntity> cards = virtualCardService.createVirtualCards(command, orgAdmin);

        // Then
        assertThat(cards).hasSize(2);
        assertThat(cards).extracting(PaymentMethodEntity::getRecipientEmail)
                .containsExactly("alice@example.org", "bob@example.org");
        assertThat(cards).extracting(PaymentMethodEntity::getClaimCode).containsExactly("AAAA2222", "BBBB3333");
        assertThat(cards).allSatisfy(card -> {
            assertThat(card.getType()).isEqualTo(PaymentMethodType.VIRTUAL_CARD);
            assertThat(card.getParentPaymentMethodId()).isEqualTo(creditCard.getId());
            assertThat(card.getAccountId()).isEqualTo(issuer.getId());
            assertThat(card.getInitialBalance()).isEqualByComparingTo("50.00");
            assertThat(card.getExpiryDate()).isEqualTo(LocalDate.of(2028, 3, 1));
        });

        InOrder order = inOrder(paymentMethodRepository, notificationDispatcher);
        order.verify(paymentMethodRepository).saveAll(anyList());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<VirtualCardInvitationNotification>> invitations = ArgumentCaptor.forClass(List.class);
        order.verify(notificationDispatcher).dispatchAll(invitations.capture());
        assertThat(invitations.getValue()).hasSize(2);
        assertThat(invitations.getValue()).extracting(VirtualCardInvitationNotification::getClaimCode)
                .containsExactly("AAAA2222", "BBBB3333");
        assertThat(invitations.getValue()).extracting(VirtualCardInvitationNotification::getCustomMessage)
                .containsOnly("Thanks for contributing");
        verify(metrics).recordVirtualCardsIssued(2);
    }

    @Test
    @DisplayName("A count mints unbound cards with no invitations and skips codes already taken")
    void createVirtualCards_CountOnly_MintsUnboundCards() {
        // Given
        when(paymentMethodRepository.findById(creditCard.getId())).thenReturn(Optional.of(creditCard));
        when(claimCodeGenerator.next()).thenReturn("TAKEN222", "CCCC4444", "CCCC4444", "DDDD5555");
        when(paymentMethodRepository.existsByClaimCode("TAKEN222")).thenReturn(true);
        when(paymentMethodRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
        CreateVirtualCardsCommand command = batch()
                .paymentMethodId(creditCard.getId())
                .numberOfVirtualCards(2)
                .amount(null)
                .monthlyLimitPerMember(new BigDecimal("20.00"))
                .build();

        // When
        List<PaymentMethodEntity> cards = virtualCardService.createVirtualCards(command, orgAdmin);

        // Then
        assertThat(cards).extracting(PaymentMethodEntity::getRecipientEmail).containsOnlyNulls();
        assertThat(cards).extracting(PaymentMethodEntity::getClaimCode).containsExactly("CCCC4444", "DDDD5555");
        assertThat(cards).extracting(PaymentMethodEntity::getMonthlyLimitPerMember)
                .usingElementComparator(BigDecimal::compareTo)
                .containsOnly(new BigDecimal("20.00"));
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<VirtualCardInvitationNotification>> invitations = ArgumentCaptor.forClass(List.class);
        verify(notificationDispatcher).dispatchAll(invitations.capture());
        assertThat(invitations.getValue()).isEmpty();
    }

    @Test
    @DisplayName("Open-source restriction limits cards to the configured host")
    void createVirtualCards_OpenSource_LimitsToConfiguredHost() {
        // Given
        AccountEntity openSourceHost = AccountEntity.organization("Open Source Collective", null, CurrencyCode.USD);
        properties.setOpenSourceHostId(openSourceHost.getId());
        when(accountService.find(openSourceHost.getId())).thenReturn(Optional.of(openSourceHost));
        when(paymentMethodRepository.findActiveCreditCards(issuer.getId())).thenReturn(List.of(creditCard));
        when(claimCodeGenerator.next()).thenReturn("EEEE6666");
        when(paymentMethodRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

        // When
        List<PaymentMethodEntity> cards = virtualCardService.createVirtualCards(
                batch().numberOfVirtualCards(1).limitedToOpenSourceCollectives(true).build(), orgAdmin);

        // Then
        assertThat(cards.get(0).getLimitedToHostCollectiveIds()).containsExactly(openSourceHost.getId());
    }

    @Test
    @DisplayName("Without a credit card to fund them, no cards are issued")
    void createVirtualCards_NoCreditCard_ThrowsValidation() {
        // Given
        when(paymentMethodRepository.findActiveCreditCards(issuer.getId())).thenReturn(List.of());

        // When / Then
        assertThatThrownBy(() -> virtualCardService.createVirtualCards(batch().numberOfVirtualCards(1).build(), orgAdmin))
                .isInstanceOf(ValidationException.class);
        verify(paymentMethodRepository, never()).saveAll(any());
    }

    @Test
    @DisplayName("A currency other than the funding card's is rejected")
    void createVirtualCards_CurrencyMismatch_ThrowsValidation() {
        // Given
        when(paymentMethodRepository.findActiveCreditCards(issuer.getId())).thenReturn(List.of(creditCard));

        // When / Then
        assertThatThrownBy(() -> virtualCardService.createVirtualCards(
                batch().numberOfVirtualCards(1).currency(CurrencyCode.EUR).build(), orgAdmin))
                .isInstanceOf(ValidationException.class);
    }
}
