package com.tripmate.backend.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.tripmate.backend.global.error.ErrorCode;
import com.tripmate.backend.global.error.ProblemException;
import com.tripmate.backend.global.security.AuthenticatedPrincipal;
import com.tripmate.backend.modules.auth.domain.User;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.tripmate.backend.modules.auth.presentation.dto.SessionResponse;
import com.tripmate.backend.modules.permission.application.PermissionService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Superadmin management, session administration and account deletion. Callers are expected to
 * have passed the matching {@code PermissionGuard} check.
 */
@Service
@Transactional
public class UserAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(UserAdministrationService.class);

    private final UserRepository userRepository;
    private final PermissionService permissionService;
    private final SessionRevocationService sessionRevocationService;
    private final UserCacheStore userCacheStore;

    public UserAdministrationService(
            UserRepository userRepository,
            PermissionService permissionService,
            SessionRevocationService sessionRevocationService,
            UserCacheStore userCacheStore
    ) {
        this.userRepository = userRepository;
        this.permissionService = permissionService;
        this.sessionRevocationService = sessionRevocationService;
        this.userCacheStore = userCacheStore;
    }

    public void assignSuperAdmin(UUID userId) {
        User user = findUser(userId);
        permissionService.grantSuperAdmin(userId);
        userCacheStore.invalidate(userId, user.getEmail());
        log.info("Superadmin granted to user {}", userId);
    }

    public void removeSuperAdmin(AuthenticatedPrincipal actor, UUID userId) {
        if (actor.userId().equals(userId)) {
            throw new ProblemException(ErrorCode.BAD_REQUEST, "Cannot remove your own superadmin privileges");
        }
        User user = findUser(userId);
        permissionService.revokeSuperAdmin(userId);
        userCacheStore.invalidate(userId, user.getEmail());
        log.info("Superadmin revoked from user {} by {}", userId, actor.userId());
    }

    @Transactional(readOnly = true)
    public List<SessionResponse> listSessions(UUID userId) {
        findUser(userId);
        return sessionRevocationService.listSessions(userId).stream()
                .map(SessionResponse::from)
                .toList();
    }

    public void revokeSessions(UUID userId) {
        findUser(userId);
        sessionRevocationService.revokeAllSessions(userId);
    }

    public void revokeSession(UUID userId, String sessionId) {
        findUser(userId);
        if (!sessionRevocationService.revokeSessionByFingerprint(userId, sessionId)) {
            throw new ProblemException(ErrorCode.NOT_FOUND, "Session not found");
        }
    }

    /**
     * Profile and refresh-token rows go with the user through foreign-key cascades.
     */
    public void deleteUser(AuthenticatedPrincipal actor, UUID userId) {
        User user = findUser(userId);
        permissionService.deleteAllRelations(userId);
        sessionRevocationService.revokeAllSessions(userId);
        userRepository.delete(user);
        userCacheStore.invalidate(userId, user.getEmail());
        log.info("User {} deleted by {}", userId, actor.userId());
    }

    private User findUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "User not found"));
    }
}
