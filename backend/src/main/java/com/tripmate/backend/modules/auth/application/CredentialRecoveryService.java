package com.tripmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.tripmate.backend.global.config.AuthProperties;
import com.tripmate.backend.global.error.ErrorCode;
import com.tripmate.backend.global.error.ProblemException;
import com.tripmate.backend.modules.auth.domain.User;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserProfileRepository;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Password reset and email verification, both driven by one-time tokens stored on the user row.
 */
@Service
@Transactional
public class CredentialRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(CredentialRecoveryService.class);

    public static final String RESET_REQUESTED_MESSAGE = "If the email exists, a password reset link has been sent";
    public static final String ALREADY_VERIFIED_MESSAGE = "Email already verified";
    public static final String VERIFICATION_SENT_MESSAGE = "Verification email sent";

    private final UserRepository userRepository;
    private final UserProfileRepository userProfileRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionRevocationService sessionRevocationService;
    private final UserCacheStore userCacheStore;
    private final OneTimeTokenGenerator tokenGenerator;
    private final PasswordResetNotifier notifier;
    private final AuthProperties authProperties;
    private final Clock clock;

    public CredentialRecoveryService(
            UserRepository userRepository,
            UserProfileRepository userProfileRepository,
            PasswordEncoder passwordEncoder,
            SessionRevocationService sessionRevocationService,
            UserCacheStore userCacheStore,
            OneTimeTokenGenerator tokenGenerator,
            PasswordResetNotifier notifier,
            AuthProperties authProperties,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.userProfileRepository = userProfileRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionRevocationService = sessionRevocationService;
        this.userCacheStore = userCacheStore;
        this.tokenGenerator = tokenGenerator;
        this.notifier = notifier;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    /**
     * Answers the same way whether or not the email belongs to an account.
     */
    public String forgotPassword(String email) {
        Optional<User> user = userRepository.findByEmailIgnoreCase(AuthService.normalizeEmail(email));
        if (user.isEmpty()) {
            log.debug("Password reset requested for unknown email");
            return RESET_REQUESTED_MESSAGE;
        }
        String token = tokenGenerator.next();
        OffsetDateTime expiry = OffsetDateTime.now(clock).plus(authProperties.resetTokenTtl());
        User account = user.get();
        account.startPasswordReset(token, expiry);
        userRepository.save(account);
        notifier.sendPasswordReset(account.getEmail(), token, expiry);
        return RESET_REQUESTED_MESSAGE;
    }

    public void resetPassword(String token, String newPassword) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        User user = userRepository.findByResetPasswordToken(token)
                .filter(candidate -> candidate.isResetTokenValid(now))
                .orElseThrow(() -> new ProblemException(ErrorCode.INVALID_RESET_TOKEN));

        user.setPasswordHash(passwordEncoder.encode(newPassword));
        user.clearPasswordReset();
        userRepository.save(user);

        sessionRevocationService.revokeAllSessions(user.getId());
        userCacheStore.invalidate(user.getId(), user.getEmail());
        log.info("Password reset completed for user {}", user.getId());
    }

    public void verifyEmail(String token) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        User user = userRepository.findByEmailVerificationToken(token)
                .filter(candidate -> candidate.isVerificationTokenValid(now))
                .orElseThrow(() -> new ProblemException(ErrorCode.INVALID_VERIFICATION_TOKEN));

        user.markEmailVerified();
        userRepository.save(user);
        userProfileRepository.markEmailVerified(user.getId());
        userCacheStore.invalidate(user.getId(), user.getEmail());
        log.info("Email verified for user {}", user.getId());
    }

    public String resendVerification(String email) {
        User user = userRepository.findByEmailIgnoreCase(AuthService.normalizeEmail(email))
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "User not found"));
        if (user.isEmailVerified()) {
            return ALREADY_VERIFIED_MESSAGE;
        }
        String token = tokenGenerator.next();
        OffsetDateTime expiry = OffsetDateTime.now(clock).plus(authProperties.verificationTokenTtl());
        user.startEmailVerification(token, expiry);
        userRepository.save(user);
        notifier.sendEmailVerification(user.getEmail(), token, expiry);
        return VERIFICATION_SENT_MESSAGE;
    }
}
