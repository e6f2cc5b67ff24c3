package com.tripmate.backend.modules.auth.application;

import java.time.OffsetDateTime;

/**
 * Delivers one-time tokens to the account owner.
 */
public interface PasswordResetNotifier {

    void sendPasswordReset(String email, String resetToken, OffsetDateTime expiresAt);

    void sendEmailVerification(String email, String verificationToken, OffsetDateTime expiresAt);
}
