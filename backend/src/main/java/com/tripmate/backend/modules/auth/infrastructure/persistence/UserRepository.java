package com.tripmate.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.modules.auth.domain.User;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    Optional<User> findByResetPasswordToken(String resetPasswordToken);

    Optional<User> findByEmailVerificationToken(String emailVerificationToken);
}
