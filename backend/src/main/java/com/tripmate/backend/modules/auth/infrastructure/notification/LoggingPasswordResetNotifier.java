package com.tripmate.backend.modules.auth.infrastructure.notification;

import java.time.OffsetDateTime;

import com.tripmate.backend.modules.auth.application.PasswordResetNotifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records that a token was issued. The token itself is not written anywhere.
 */
@Component
public class LoggingPasswordResetNotifier implements PasswordResetNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingPasswordResetNotifier.class);

    @Override
    public void sendPasswordReset(String email, String resetToken, OffsetDateTime expiresAt) {
        log.info("Password reset requested for {} (expires {})", mask(email), expiresAt);
    }

    @Override
    public void sendEmailVerification(String email, String verificationToken, OffsetDateTime expiresAt) {
        log.info("Email verification issued for {} (expires {})", mask(email), expiresAt);
    }

    static String mask(String email) {
        int at = email.indexOf('@');
        if (at <= 1) {
            return "***" + (at >= 0 ? email.substring(at) : "");
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
