package com.tripmate.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.modules.auth.domain.UserProfile;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {

    Optional<UserProfile> findByUserId(UUID userId);

    @Modifying
    @Query("update UserProfile p set p.emailVerified = true where p.user.id = :userId")
    int markEmailVerified(@Param("userId") UUID userId);
}
