package com.tripmate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.modules.auth.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    @Query("""
            select rt
              from RefreshToken rt
             where rt.token = :token
               and rt.user.id = :userId
               and rt.revoked = false
               and rt.expiresAt > :now
            """)
    Optional<RefreshToken> findActive(@Param("token") String token,
                                      @Param("userId") UUID userId,
                                      @Param("now") OffsetDateTime now);

    @Query("select rt from RefreshToken rt where rt.user.id = :userId and rt.revoked = false")
    List<RefreshToken> findUnrevokedByUser(@Param("userId") UUID userId);

    @Modifying
    @Query("update RefreshToken rt set rt.revoked = true where rt.token = :token and rt.user.id = :userId")
    int revokeByTokenAndUser(@Param("token") String token, @Param("userId") UUID userId);

    @Modifying
    @Query("update RefreshToken rt set rt.revoked = true where rt.user.id = :userId and rt.revoked = false")
    int revokeAllByUser(@Param("userId") UUID userId);

    @Modifying
    @Query("delete from RefreshToken rt where rt.expiresAt <= :now or rt.revoked = true")
    int deleteExpiredOrRevoked(@Param("now") OffsetDateTime now);
}
