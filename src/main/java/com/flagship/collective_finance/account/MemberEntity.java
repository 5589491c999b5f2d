package com.flagship.collective_finance.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Role assignment: {@code memberAccountId} holds {@code role} on {@code accountId}.
 */
@Entity
@Table(name = "members",
       uniqueConstraints = @UniqueConstraint(name = "uq_members_pair_role",
               columnNames = {"member_account_id", "account_id", "role"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MemberEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "member_account_id", nullable = false, updatable = false)
    private UUID memberAccountId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private Role role;

    @Column(name = "created_by_user_id")
    private UUID createdByUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static MemberEntity of(UUID memberAccountId, UUID accountId, Role role, UUID createdByUserId) {
        return new MemberEntity(UUID.randomUUID(), memberAccountId, accountId, role, createdByUserId, null);
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }
}
