package com.flagship.collective_finance.account;

import com.flagship.collective_finance.auth.Action;
import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.AuthorizationTarget;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.config.FinanceProperties;
import com.flagship.collective_finance.error.NotFoundException;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.notification.NotificationDispatcher;
import com.flagship.collective_finance.notification.WelcomeNotification;
import com.flagship.collective_finance.observability.MutationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Account lookups and the composite account-creation writes.
 *
 * <p>{@link #createUser} creates the user, the optional organization and the
 * ADMIN membership linking them in one unit of work. The welcome email is
 * queued in the same unit of work and only sent after commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final MemberRepository memberRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final AuthorizationGuard guard;
    private final FinanceProperties properties;
    private final MutationMetrics metrics;

    @Transactional
    public CreateUserResult createUser(CreateUserCommand command, Principal principal) {
        long startTime = System.currentTimeMillis();
        guard.require(principal, Action.CREATE_USER, AuthorizationTarget.none());

        try {
            String email = normalizedEmail(command.getEmail());
            if (accountRepository.existsByEmail(email)) {
                throw new ValidationException("User already exists for given email");
            }

            AccountEntity user = accountRepository.save(
                    AccountEntity.user(command.getName(), email, properties.getDefaultCurrency()));

            AccountEntity organization = null;
            if (command.withOrganization()) {
                organization = accountRepository.save(AccountEntity.organization(
                        command.getOrganizationName().trim(), command.getOrganizationWebsite(),
                        properties.getDefaultCurrency()));
                memberRepository.save(MemberEntity.of(user.getId(), organization.getId(), Role.ADMIN, user.getId()));
            }

            notificationDispatcher.dispatch(new WelcomeNotification(user.getId(), user.getEmail(), user.getName(),
                    organization == null ? null : organization.getId(),
                    organization == null ? null : organization.getName()));

            metrics.recordOutcome("create_user", "success", System.currentTimeMillis() - startTime);
            log.info("Created user: userId={}, organizationId={}",
                    user.getId(), organization == null ? null : organization.getId());
            return new CreateUserResult(user, organization);

        } catch (RuntimeException e) {
            metrics.recordOutcome("create_user", "error", System.currentTimeMillis() - startTime);
            log.warn("User creation failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Returns the user account registered under {@code email}, creating it
     * (and queueing a welcome email) when none exists. Joins the caller's
     * unit of work.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AccountEntity findOrCreateUser(String email, String name) {
        String normalized = normalizedEmail(email);
        return accountRepository.findByEmail(normalized).orElseGet(() -> {
            AccountEntity user = accountRepository.save(
                    AccountEntity.user(name, normalized, properties.getDefaultCurrency()));
            notificationDispatcher.dispatch(
                    new WelcomeNotification(user.getId(), user.getEmail(), user.getName(), null, null));
            log.info("Created user {} on the fly", user.getId());
            return user;
        });
    }

    /**
     * Locks the account row for the rest of the caller's unit of work, so
     * that a balance read and the debit that follows it cannot interleave
     * with another debit of the same account.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AccountEntity lockForDebit(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> NotFoundException.of("Account", accountId));
    }

    @Transactional(readOnly = true)
    public Optional<AccountEntity> find(UUID accountId) {
        return accountId == null ? Optional.empty() : accountRepository.findById(accountId);
    }

    @Transactional(readOnly = true)
    public AccountEntity getRequired(UUID accountId) {
        if (accountId == null) {
            throw new ValidationException("Account id is required");
        }
        return accountRepository.findById(accountId)
                .orElseThrow(() -> NotFoundException.of("Account", accountId));
    }

    private static String normalizedEmail(String email) {
        try {
            return AccountEntity.normalizeEmail(email);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }
}
