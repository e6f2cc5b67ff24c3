package com.tripmate.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import com.tripmate.backend.global.jpa.AbstractUuidEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Durable copy of an issued refresh token. Consulted when the Redis fingerprint is gone.
 */
@Entity
@Table(name = "refresh_tokens")
public class RefreshToken extends AbstractUuidEntity {

    @Column(name = "token", nullable = false, unique = true, columnDefinition = "text")
    private String token;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "is_revoked", nullable = false)
    private boolean revoked;

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public User getUser() {
        return user;
    }

    public void setUser(User user) {
        this.user = user;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public void setRevoked(boolean revoked) {
        this.revoked = revoked;
    }

    public boolean isActive(OffsetDateTime now) {
        return !revoked && expiresAt.isAfter(now);
    }
}
