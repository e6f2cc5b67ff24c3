package com.tripmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.global.config.AuthProperties;
import com.tripmate.backend.global.error.ErrorCode;
import com.tripmate.backend.global.error.ProblemException;
import com.tripmate.backend.global.security.AuthenticatedPrincipal;
import com.tripmate.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.tripmate.backend.modules.auth.application.JwtTokenService.TokenClaims;
import com.tripmate.backend.modules.auth.application.JwtTokenService.TokenExpiredException;
import com.tripmate.backend.modules.auth.application.JwtTokenService.TokenPair;
import com.tripmate.backend.modules.auth.domain.RefreshToken;
import com.tripmate.backend.modules.auth.domain.User;
import com.tripmate.backend.modules.auth.domain.UserProfile;
import com.tripmate.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserProfileRepository;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.tripmate.backend.modules.auth.presentation.dto.AuthResponse;
import com.tripmate.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.tripmate.backend.modules.auth.presentation.dto.LoginRequest;
import com.tripmate.backend.modules.auth.presentation.dto.LogoutRequest;
import com.tripmate.backend.modules.auth.presentation.dto.RefreshTokenResponse;
import com.tripmate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.tripmate.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.tripmate.backend.modules.auth.presentation.dto.UserResponse;
import com.tripmate.backend.modules.permission.application.PermissionService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final UserProfileRepository userProfileRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final RefreshTokenFingerprintStore fingerprintStore;
    private final AccessTokenStore accessTokenStore;
    private final UserCacheStore userCacheStore;
    private final SessionRevocationService sessionRevocationService;
    private final PermissionService permissionService;
    private final OneTimeTokenGenerator tokenGenerator;
    private final PasswordResetNotifier notifier;
    private final AuthProperties authProperties;
    private final Clock clock;
    // compared against when the email is unknown so both failure paths cost one bcrypt check
    private final String dummyPasswordHash;

    public AuthService(
            UserRepository userRepository,
            UserProfileRepository userProfileRepository,
            RefreshTokenRepository refreshTokenRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            RefreshTokenFingerprintStore fingerprintStore,
            AccessTokenStore accessTokenStore,
            UserCacheStore userCacheStore,
            SessionRevocationService sessionRevocationService,
            PermissionService permissionService,
            OneTimeTokenGenerator tokenGenerator,
            PasswordResetNotifier notifier,
            AuthProperties authProperties,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.userProfileRepository = userProfileRepository;
        this.refreshTokenRepository = refreshTokenRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.fingerprintStore = fingerprintStore;
        this.accessTokenStore = accessTokenStore;
        this.userCacheStore = userCacheStore;
        this.sessionRevocationService = sessionRevocationService;
        this.permissionService = permissionService;
        this.tokenGenerator = tokenGenerator;
        this.notifier = notifier;
        this.authProperties = authProperties;
        this.clock = clock;
        this.dummyPasswordHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public AuthResponse register(RegisterRequest request, SessionContext context) {
        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(ErrorCode.CONFLICT, "User with this email already exists");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        User user = new User();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setName(request.name().trim());
        user.setPhone(request.phone());
        String verificationToken = tokenGenerator.next();
        OffsetDateTime verificationExpiry = now.plus(authProperties.verificationTokenTtl());
        user.startEmailVerification(verificationToken, verificationExpiry);
        try {
            // flushed here so a concurrent registration of the same email surfaces as a conflict
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            log.info("Registration rejected by the unique email constraint");
            throw new ProblemException(ErrorCode.CONFLICT, "User with this email already exists");
        }

        UserProfile profile = new UserProfile();
        profile.setUser(user);
        profile = userProfileRepository.save(profile);
        permissionService.createProfileRelations(user.getId(), profile.getId());

        TokenPair tokens = jwtTokenService.issueTokenPair(user.getId(), email);
        startSession(user, tokens, FingerprintMetadata.forRegistration(context), now);

        CachedUser snapshot = CachedUser.from(user, profile);
        userCacheStore.cache(snapshot);
        notifier.sendEmailVerification(email, verificationToken, verificationExpiry);

        log.info("Registered user {}", user.getId());
        return new AuthResponse(UserResponse.of(snapshot, false), TokenPairResponse.from(tokens));
    }

    public AuthResponse login(LoginRequest request, SessionContext context) {
        Optional<User> candidate = userRepository.findByEmailIgnoreCase(normalizeEmail(request.email()));
        if (candidate.isEmpty()) {
            passwordEncoder.matches(request.password(), dummyPasswordHash);
            throw new ProblemException(ErrorCode.INVALID_CREDENTIALS);
        }
        User user = candidate.get();
        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(ErrorCode.INVALID_CREDENTIALS);
        }

        boolean superAdmin = permissionService.isSuperAdmin(user.getId());
        OffsetDateTime now = OffsetDateTime.now(clock);
        TokenPair tokens = jwtTokenService.issueTokenPair(user.getId(), user.getEmail());
        startSession(user, tokens, FingerprintMetadata.forLogin(context, now), now);

        UserProfile profile = userProfileRepository.findByUserId(user.getId()).orElseGet(() -> {
            UserProfile created = new UserProfile();
            created.setUser(user);
            return created;
        });
        profile.setLastLogin(now);
        profile = userProfileRepository.save(profile);

        CachedUser snapshot = CachedUser.from(user, profile);
        userCacheStore.invalidate(user.getId(), user.getEmail());
        userCacheStore.cache(snapshot);

        log.info("User {} logged in", user.getId());
        return new AuthResponse(UserResponse.of(snapshot, superAdmin), TokenPairResponse.from(tokens));
    }

    /**
     * Issues a new access token. The refresh token is returned unchanged.
     */
    public RefreshTokenResponse refresh(String rawRefreshToken) {
        TokenClaims claims;
        try {
            claims = jwtTokenService.verifyRefresh(rawRefreshToken);
        } catch (TokenExpiredException | InvalidTokenException ex) {
            throw new ProblemException(ErrorCode.INVALID_REFRESH_TOKEN);
        }
        UUID userId = claims.userId();

        if (fingerprintStore.validate(userId, rawRefreshToken).isEmpty()) {
            OffsetDateTime now = OffsetDateTime.now(clock);
            RefreshToken durable = refreshTokenRepository.findActive(rawRefreshToken, userId, now)
                    .orElseThrow(() -> new ProblemException(ErrorCode.REFRESH_TOKEN_EXPIRED_OR_REVOKED));
            fingerprintStore.store(userId, rawRefreshToken, FingerprintMetadata.restoredFromDurableStore());
            log.info("Restored refresh fingerprint for user {} from durable token {}", userId, durable.getId());
        }

        String email = userCacheStore.findById(userId)
                .map(CachedUser::email)
                .orElseGet(() -> userRepository.findById(userId)
                        .map(User::getEmail)
                        .orElseThrow(() -> new ProblemException(ErrorCode.USER_NOT_FOUND)));

        String accessToken = jwtTokenService.issueAccessToken(userId, email);
        accessTokenStore.cache(userId, accessToken);
        return new RefreshTokenResponse(
                accessToken,
                rawRefreshToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                jwtTokenService.getAccessTokenTtl().toSeconds()
        );
    }

    public void logout(AuthenticatedPrincipal principal, String rawAccessToken, LogoutRequest request) {
        UUID userId = principal.userId();
        String refreshToken = request != null ? request.refreshToken() : null;
        if (refreshToken != null && !refreshToken.isBlank()) {
            sessionRevocationService.revokeSession(userId, refreshToken);
        } else {
            sessionRevocationService.revokeAllSessions(userId);
        }
        sessionRevocationService.blacklistAccessToken(rawAccessToken);
        userCacheStore.invalidate(userId, principal.email());
    }

    public void changePassword(AuthenticatedPrincipal principal, String rawAccessToken, ChangePasswordRequest request) {
        User user = userRepository.findById(principal.userId())
                .orElseThrow(() -> new ProblemException(ErrorCode.USER_NOT_FOUND));
        if (!passwordEncoder.matches(request.currentPassword(), user.getPasswordHash())) {
            throw new ProblemException(ErrorCode.CURRENT_PASSWORD_INCORRECT);
        }
        if (passwordEncoder.matches(request.newPassword(), user.getPasswordHash())) {
            throw new ProblemException(ErrorCode.BAD_REQUEST, "New password must be different from the current password");
        }

        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        userRepository.save(user);

        sessionRevocationService.revokeAllSessions(user.getId());
        sessionRevocationService.blacklistAccessToken(rawAccessToken);
        userCacheStore.invalidate(user.getId(), user.getEmail());
        log.info("User {} changed password, all sessions revoked", user.getId());
    }

    @Transactional(readOnly = true)
    public UserResponse me(AuthenticatedPrincipal principal) {
        CachedUser user = userCacheStore.findById(principal.userId()).orElseGet(() -> {
            User entity = userRepository.findById(principal.userId())
                    .orElseThrow(() -> new ProblemException(ErrorCode.USER_NOT_FOUND));
            CachedUser snapshot = CachedUser.from(entity, userProfileRepository.findByUserId(entity.getId()).orElse(null));
            userCacheStore.cache(snapshot);
            return snapshot;
        });
        return UserResponse.of(user, principal.superAdmin());
    }

    private void startSession(User user, TokenPair tokens, FingerprintMetadata metadata, OffsetDateTime now) {
        fingerprintStore.store(user.getId(), tokens.refreshToken(), metadata);

        RefreshToken row = new RefreshToken();
        row.setToken(tokens.refreshToken());
        row.setUser(user);
        row.setExpiresAt(now.plus(jwtTokenService.getRefreshTokenTtl()));
        refreshTokenRepository.save(row);

        accessTokenStore.cache(user.getId(), tokens.accessToken());
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
