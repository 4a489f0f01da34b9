package com.ecommerce.user.modules.account.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Revoked refresh token, keyed by its {@code jti}. Kept until the token would have expired anyway.
 */
@Entity
@Table(name = "revoked_token")
public class RevokedToken {

    @Id
    @Column(name = "token_id", nullable = false, updatable = false, length = 64)
    private String tokenId;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "revoked_at", nullable = false)
    private OffsetDateTime revokedAt;

    protected RevokedToken() {
    }

    public RevokedToken(String tokenId, UUID userId, OffsetDateTime expiresAt, OffsetDateTime revokedAt) {
        this.tokenId = tokenId;
        this.userId = userId;
        this.expiresAt = expiresAt;
        this.revokedAt = revokedAt;
    }

    public String getTokenId() {
        return tokenId;
    }

    public UUID getUserId() {
        return userId;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }
}
