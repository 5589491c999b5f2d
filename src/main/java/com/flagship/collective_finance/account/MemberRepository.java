package com.flagship.collective_finance.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface MemberRepository extends JpaRepository<MemberEntity, UUID> {

    boolean existsByMemberAccountIdAndAccountIdAndRole(UUID memberAccountId, UUID accountId, Role role);

    boolean existsByMemberAccountIdAndAccountIdInAndRole(UUID memberAccountId, Collection<UUID> accountIds, Role role);

    List<MemberEntity> findByAccountId(UUID accountId);
}
