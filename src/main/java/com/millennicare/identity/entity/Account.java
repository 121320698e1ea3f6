package com.millennicare.identity.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * One authentication method bound to a user.
 * A {@code credentials} account carries a password hash and no provider tokens;
 * a federated account carries provider tokens and never a password hash.
 */
@Entity
@Table(
        name = "accounts",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_accounts_user_provider", columnNames = {"user_id", "provider_id"}),
                @UniqueConstraint(name = "uk_accounts_provider_account", columnNames = {"provider_id", "provider_account_id"})
        },
        indexes = @Index(name = "ix_accounts_user", columnList = "user_id")
)
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
public class Account extends BaseEntity {

    /** External user id at the provider, or the user's own id for {@code credentials}. */
    @ToString.Include
    @Column(name = "provider_account_id", nullable = false, length = 255)
    private String providerAccountId;

    @ToString.Include
    @Column(name = "provider_id", nullable = false, length = 32)
    private String providerId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    @Column(name = "access_token", length = 4096)
    private String accessToken;

    @Column(name = "refresh_token", length = 4096)
    private String refreshToken;

    @Column(name = "id_token", length = 4096)
    private String idToken;

    @Column(name = "access_token_expires_at")
    private Instant accessTokenExpiresAt;

    @Column(name = "scope", length = 1024)
    private String scope;

    public boolean isCredentials() {
        return AuthProvider.CREDENTIALS.id().equals(providerId);
    }
}
