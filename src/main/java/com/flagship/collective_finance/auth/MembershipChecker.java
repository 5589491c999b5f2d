package com.flagship.collective_finance.auth;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountRepository;
import com.flagship.collective_finance.account.MemberRepository;
import com.flagship.collective_finance.account.Role;
import com.flagship.collective_finance.config.FinanceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Role lookups against the membership table.
 *
 * A user account counts as administrator of itself.
 */
@Component
@RequiredArgsConstructor
public class MembershipChecker {

    private final MemberRepository memberRepository;
    private final AccountRepository accountRepository;
    private final FinanceProperties properties;

    @Transactional(readOnly = true)
    public boolean isAdminOf(UUID userAccountId, UUID accountId) {
        if (userAccountId == null || accountId == null) {
            return false;
        }
        if (userAccountId.equals(accountId)) {
            return true;
        }
        return memberRepository.existsByMemberAccountIdAndAccountIdAndRole(userAccountId, accountId, Role.ADMIN);
    }

    /**
     * True when the user administers the fiscal host of {@code accountId},
     * or {@code accountId} is itself a host the user administers.
     */
    @Transactional(readOnly = true)
    public boolean isHostAdminOf(UUID userAccountId, UUID accountId) {
        if (userAccountId == null || accountId == null) {
            return false;
        }
        AccountEntity account = accountRepository.findById(accountId).orElse(null);
        if (account == null) {
            return false;
        }
        if (account.isHost() && isAdminOf(userAccountId, account.getId())) {
            return true;
        }
        return account.getHostAccountId() != null && isAdminOf(userAccountId, account.getHostAccountId());
    }

    @Transactional(readOnly = true)
    public boolean isPlatformAdmin(UUID userAccountId) {
        UUID platformAccountId = properties.getPlatformAccountId();
        return platformAccountId != null
                && userAccountId != null
                && memberRepository.existsByMemberAccountIdAndAccountIdAndRole(userAccountId, platformAccountId, Role.ADMIN);
    }
}
