package com.tripmate.backend.modules.auth.application;

import com.tripmate.backend.global.config.SuperAdminBootstrapProperties;
import com.tripmate.backend.modules.auth.domain.User;
import com.tripmate.backend.modules.auth.domain.UserProfile;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserProfileRepository;
import com.tripmate.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.tripmate.backend.modules.permission.application.PermissionService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the configured superadmin account on startup, or promotes it when the account
 * already exists.
 */
@Component
public class SuperAdminBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SuperAdminBootstrap.class);

    private final SuperAdminBootstrapProperties properties;
    private final UserRepository userRepository;
    private final UserProfileRepository userProfileRepository;
    private final PasswordEncoder passwordEncoder;
    private final PermissionService permissionService;

    public SuperAdminBootstrap(
            SuperAdminBootstrapProperties properties,
            UserRepository userRepository,
            UserProfileRepository userProfileRepository,
            PasswordEncoder passwordEncoder,
            PermissionService permissionService
    ) {
        this.properties = properties;
        this.userRepository = userRepository;
        this.userProfileRepository = userProfileRepository;
        this.passwordEncoder = passwordEncoder;
        this.permissionService = permissionService;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!properties.isConfigured()) {
            return;
        }
        String email = AuthService.normalizeEmail(properties.email());
        User user = userRepository.findByEmailIgnoreCase(email).orElseGet(() -> createUser(email));
        permissionService.grantSuperAdmin(user.getId());
        log.info("Superadmin bootstrap ensured for user {}", user.getId());
    }

    private User createUser(String email) {
        User user = new User();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(properties.password()));
        user.setName(properties.name());
        user.setPhone(properties.phone());
        user.setEmailVerified(true);
        User saved = userRepository.save(user);

        UserProfile profile = new UserProfile();
        profile.setUser(saved);
        profile.setEmailVerified(true);
        UserProfile savedProfile = userProfileRepository.save(profile);
        permissionService.createProfileRelations(saved.getId(), savedProfile.getId());
        log.info("Created bootstrap superadmin account {}", saved.getId());
        return saved;
    }
}
