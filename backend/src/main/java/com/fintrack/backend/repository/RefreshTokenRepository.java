package com.fintrack.backend.repository;

import com.fintrack.backend.model.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    Optional<RefreshToken> findByUserId(UUID userId);

    Optional<RefreshToken> findByUserIdAndExpiresAtGreaterThanEqual(UUID userId, Instant now);

    @Transactional
    @Modifying
    @Query("update RefreshToken t set t.tokenHash = :tokenHash, t.expiresAt = :expiresAt, t.createdAt = :createdAt "
            + "where t.userId = :userId")
    int updateByUserId(@Param("userId") UUID userId,
                       @Param("tokenHash") String tokenHash,
                       @Param("expiresAt") Instant expiresAt,
                       @Param("createdAt") Instant createdAt);

    @Transactional
    @Modifying
    @Query("delete from RefreshToken t where t.userId = :userId and t.tokenHash = :tokenHash")
    int deleteByUserIdAndTokenHash(@Param("userId") UUID userId, @Param("tokenHash") String tokenHash);
}
