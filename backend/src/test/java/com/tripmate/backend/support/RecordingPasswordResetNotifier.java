package com.tripmate.backend.support;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

import com.tripmate.backend.modules.auth.application.PasswordResetNotifier;

public class RecordingPasswordResetNotifier implements PasswordResetNotifier {

    private final Map<String, String> resetTokens = new HashMap<>();
    private final Map<String, String> verificationTokens = new HashMap<>();

    @Override
    public void sendPasswordReset(String email, String resetToken, OffsetDateTime expiresAt) {
        resetTokens.put(email, resetToken);
    }

    @Override
    public void sendEmailVerification(String email, String verificationToken, OffsetDateTime expiresAt) {
        verificationTokens.put(email, verificationToken);
    }

    public String resetTokenFor(String email) {
        return resetTokens.get(email);
    }

    public String verificationTokenFor(String email) {
        return verificationTokens.get(email);
    }

    public int resetCount() {
        return resetTokens.size();
    }
}
