package com.tripmate.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import com.tripmate.backend.global.jpa.AbstractUuidEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "users")
public class User extends AbstractUuidEntity {

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "name", length = 100)
    private String name;

    @Column(name = "phone", length = 32)
    private String phone;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "reset_password_token", length = 128)
    private String resetPasswordToken;

    @Column(name = "reset_password_expiry")
    private OffsetDateTime resetPasswordExpiry;

    @Column(name = "email_verification_token", length = 128)
    private String emailVerificationToken;

    @Column(name = "email_verification_expiry")
    private OffsetDateTime emailVerificationExpiry;

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public void setEmailVerified(boolean emailVerified) {
        this.emailVerified = emailVerified;
    }

    public String getResetPasswordToken() {
        return resetPasswordToken;
    }

    public OffsetDateTime getResetPasswordExpiry() {
        return resetPasswordExpiry;
    }

    public String getEmailVerificationToken() {
        return emailVerificationToken;
    }

    public OffsetDateTime getEmailVerificationExpiry() {
        return emailVerificationExpiry;
    }

    public void startPasswordReset(String token, OffsetDateTime expiry) {
        this.resetPasswordToken = token;
        this.resetPasswordExpiry = expiry;
    }

    public void clearPasswordReset() {
        this.resetPasswordToken = null;
        this.resetPasswordExpiry = null;
    }

    public void startEmailVerification(String token, OffsetDateTime expiry) {
        this.emailVerificationToken = token;
        this.emailVerificationExpiry = expiry;
    }

    public void markEmailVerified() {
        this.emailVerified = true;
        this.emailVerificationToken = null;
        this.emailVerificationExpiry = null;
    }

    public boolean isResetTokenValid(OffsetDateTime now) {
        return resetPasswordToken != null && resetPasswordExpiry != null && resetPasswordExpiry.isAfter(now);
    }

    public boolean isVerificationTokenValid(OffsetDateTime now) {
        return emailVerificationToken != null && emailVerificationExpiry != null && emailVerificationExpiry.isAfter(now);
    }
}
