package com.flagship.collective_finance.account;

import com.flagship.collective_finance.common.CurrencyCode;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * A user, organization, collective or event able to send and receive funds.
 *
 * <p>Balances are not stored here; they are always derived from the ledger.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 100)
    private String slug;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private AccountType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    /**
     * Fiscal host of this account, if any.
     */
    @Column(name = "host_account_id")
    private UUID hostAccountId;

    @Column(name = "is_host", nullable = false)
    private boolean host;

    /**
     * Login email, set for USER accounts only. Stored lower-cased.
     */
    @Column(unique = true)
    private String email;

    @Column
    private String website;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "account_tags", joinColumns = @JoinColumn(name = "account_id"))
    @Column(name = "tag", nullable = false, length = 100)
    private Set<String> tags = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private AccountEntity(UUID id, String slug, String name, AccountType type, CurrencyCode currency,
                          UUID hostAccountId, boolean host, String email, String website, Collection<String> tags) {
        this.id = id;
        this.slug = slug;
        this.name = name;
        this.type = type;
        this.currency = currency;
        this.hostAccountId = hostAccountId;
        this.host = host;
        this.email = email;
        this.website = website;
        if (tags != null) {
            this.tags.addAll(tags);
        }
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public static AccountEntity user(String name, String email, CurrencyCode currency) {
        String normalizedEmail = normalizeEmail(email);
        String displayName = name == null || name.isBlank() ? normalizedEmail.substring(0, normalizedEmail.indexOf('@')) : name;
        return new AccountEntity(UUID.randomUUID(), slugFor(displayName), displayName, AccountType.USER,
                currency, null, false, normalizedEmail, null, null);
    }

    public static AccountEntity organization(String name, String website, CurrencyCode currency) {
        return new AccountEntity(UUID.randomUUID(), slugFor(name), name, AccountType.ORGANIZATION,
                currency, null, false, null, website, null);
    }

    /**
     * Builds a hosted account. Pass {@code host = true} for an account that
     * itself acts as a fiscal host.
     */
    public static AccountEntity hosted(String name, AccountType type, CurrencyCode currency,
                                       UUID hostAccountId, boolean host, Collection<String> tags) {
        return new AccountEntity(UUID.randomUUID(), slugFor(name), name, type, currency,
                hostAccountId, host, null, null, tags);
    }

    public boolean isUser() {
        return type == AccountType.USER;
    }

    public boolean hasAnyTag(Collection<String> wanted) {
        return wanted.stream().anyMatch(tags::contains);
    }

    public static String normalizeEmail(String email) {
        if (email == null || !email.contains("@")) {
            throw new IllegalArgumentException("A valid email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    static String slugFor(String name) {
        String base = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        if (base.isEmpty()) {
            base = "account";
        }
        if (base.length() > 80) {
            base = base.substring(0, 80);
        }
        return base + "-" + UUID.randomUUID().toString().substring(0, 6);
    }
}
