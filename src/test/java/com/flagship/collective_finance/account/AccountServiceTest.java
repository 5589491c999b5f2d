package com.flagship.collective_finance.account;

import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.config.FinanceProperties;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.notification.NotificationDispatcher;
import com.flagship.collective_finance.notification.WelcomeNotification;
import com.flagship.collective_finance.observability.MutationMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    @Mock
    private AuthorizationGuard guard;

    @Mock
    private MutationMetrics metrics;

    private AccountService accountService;

    @BeforeEach
    void setUp() {
        FinanceProperties properties = new FinanceProperties();
        properties.setDefaultCurrency(CurrencyCode.EUR);
        accountService = new AccountService(accountRepository, memberRepository, notificationDispatcher, guard,
                properties, metrics);
        lenient().when(accountRepository.save(any(AccountEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("createUser")
    class CreateUser {

        @Test
        @DisplayName("Creates the user alone when no organization is requested")
        void createUser_WithoutOrganization_NoMembership() {
            // Given
            CreateUserCommand command = CreateUserCommand.builder()
                    .email("  Alice@Example.org ")
                    .name("Alice")
                    .build();

            // When
            CreateUserResult result = accountService.createUser(command, Principal.anonymous());

            // Then
            assertThat(result.getUser().getEmail()).isEqualTo("alice@example.org");
            assertThat(result.getUser().getType()).isEqualTo(AccountType.USER);
            assertThat(result.getUser().getCurrency()).isEqualTo(CurrencyCode.EUR);
            assertThat(result.getOrganization()).isNull();
            verify(memberRepository, never()).save(any());
        }

        @Test
        @DisplayName("Makes the new user ADMIN of the new organization and sends one welcome email")
        void createUser_WithOrganization_AdminMembershipAndWelcome() {
            // Given
            CreateUserCommand command = CreateUserCommand.builder()
                    .email("bob@example.org")
                    .name("Bob")
                    .organizationName(" Acme ")
                    .organizationWebsite("https://acme.example")
                    .build();

            // When
            CreateUserResult result = accountService.createUser(command, Principal.anonymous());

            // Then
            assertThat(result.getOrganization().getName()).isEqualTo("Acme");
            assertThat(result.getOrganization().getType()).isEqualTo(AccountType.ORGANIZATION);

            ArgumentCaptor<MemberEntity> member = ArgumentCaptor.forClass(MemberEntity.class);
            verify(memberRepository).save(member.capture());
            assertThat(member.getValue().getMemberAccountId()).isEqualTo(result.getUser().getId());
            assertThat(member.getValue().getAccountId()).isEqualTo(result.getOrganization().getId());
            assertThat(member.getValue().getRole()).isEqualTo(Role.ADMIN);

            ArgumentCaptor<WelcomeNotification> welcome = ArgumentCaptor.forClass(WelcomeNotification.class);
            verify(notificationDispatcher).dispatch(welcome.capture());
            assertThat(welcome.getValue().getRecipientEmail()).isEqualTo("bob@example.org");
            assertThat(welcome.getValue().getOrganizationId()).isEqualTo(result.getOrganization().getId());
        }

        @Test
        @DisplayName("Rejects an email that is already registered")
        void createUser_EmailTaken_ThrowsValidation() {
            // Given
            when(accountRepository.existsByEmail("bob@example.org")).thenReturn(true);
            CreateUserCommand command = CreateUserCommand.builder().email("BOB@example.org").build();

            // When / Then
            assertThatThrownBy(() -> accountService.createUser(command, Principal.anonymous()))
                    .isInstanceOf(ValidationException.class);
            verify(accountRepository, never()).save(any());
            verify(notificationDispatcher, never()).dispatch(any());
        }

        @Test
        @DisplayName("Rejects a malformed email")
        void createUser_MalformedEmail_ThrowsValidation() {
            CreateUserCommand command = CreateUserCommand.builder().email("not-an-email").build();

            assertThatThrownBy(() -> accountService.createUser(command, Principal.anonymous()))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("findOrCreateUser")
    class FindOrCreateUser {

        @Test
        @DisplayName("Returns the existing account without a welcome email")
        void findOrCreateUser_Existing_ReturnsIt() {
            // Given
            AccountEntity existing = AccountEntity.user("Carol", "carol@example.org", CurrencyCode.USD);
            when(accountRepository.findByEmail("carol@example.org")).thenReturn(Optional.of(existing));

            // When
            AccountEntity found = accountService.findOrCreateUser("Carol@Example.org", null);

            // Then
            assertThat(found).isSameAs(existing);
            verify(notificationDispatcher, never()).dispatch(any());
        }

        @Test
        @DisplayName("Creates an account named after the email when none exists")
        void findOrCreateUser_Unknown_CreatesAndWelcomes() {
            // Given
            when(accountRepository.findByEmail("dave@example.org")).thenReturn(Optional.empty());

            // When
            AccountEntity created = accountService.findOrCreateUser("dave@example.org", null);

            // Then
            assertThat(created.getName()).isEqualTo("dave");
            verify(notificationDispatcher).dispatch(any(WelcomeNotification.class));
        }
    }
}
