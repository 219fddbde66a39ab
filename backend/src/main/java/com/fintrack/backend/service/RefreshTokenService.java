package com.fintrack.backend.service;

import com.fintrack.backend.config.JwtProperties;
import com.fintrack.backend.model.RefreshToken;
import com.fintrack.backend.repository.RefreshTokenRepository;
import com.fintrack.backend.security.CredentialHasher;
import com.fintrack.backend.security.JwtTokenProvider;
import com.fintrack.backend.security.RefreshTokenClaims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Server-side record of the one refresh token each user may currently exchange.
 * <p>
 * Records are keyed by user id, so storing a new token replaces the previous
 * one. Expired records are ignored on lookup and never swept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private static final int MAX_STORE_ATTEMPTS = 3;

    private final RefreshTokenRepository refreshTokenRepository;
    private final CredentialHasher credentialHasher;
    private final JwtTokenProvider jwtTokenProvider;
    private final JwtProperties jwtProperties;
    private final Clock clock;

    /**
     * Replaces the user's record, creating it when there is none. Each statement
     * commits on its own so an insert that loses to a concurrent insert for the
     * same user can be retried as an update; the last writer wins.
     */
    public void storeToken(UUID userId, String rawToken) {
        String tokenHash = credentialHasher.hashToken(rawToken);
        Instant now = clock.instant();
        Instant expiresAt = now.plus(jwtProperties.getRefreshTokenTtl());

        DataAccessException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_STORE_ATTEMPTS; attempt++) {
            if (refreshTokenRepository.updateByUserId(userId, tokenHash, expiresAt, now) > 0) {
                return;
            }
            try {
                refreshTokenRepository.saveAndFlush(RefreshToken.builder()
                        .userId(userId)
                        .tokenHash(tokenHash)
                        .expiresAt(expiresAt)
                        .createdAt(now)
                        .build());
                return;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
                log.debug("Refresh token insert for user {} lost to a concurrent write (attempt {})", userId, attempt);
                lastFailure = ex;
            }
        }
        throw lastFailure;
    }

    /**
     * @return false when the user has no unexpired record or the record belongs
     * to a different token
     */
    @Transactional(readOnly = true)
    public boolean validate(UUID userId, String rawToken) {
        return refreshTokenRepository.findByUserIdAndExpiresAtGreaterThanEqual(userId, clock.instant())
                .map(token -> credentialHasher.verifyToken(rawToken, token.getTokenHash()))
                .orElse(false);
    }

    /**
     * Deletes the record of the token's owner if it was issued for this token.
     * A token that is no longer on record is a no-op.
     *
     * @throws com.fintrack.backend.exception.InvalidTokenException when the token cannot be decoded
     */
    @Transactional
    public void revokeToken(String rawToken) {
        RefreshTokenClaims claims = jwtTokenProvider.parseRefreshToken(rawToken);
        refreshTokenRepository.findByUserId(claims.userId())
                .filter(token -> credentialHasher.verifyToken(rawToken, token.getTokenHash()))
                .ifPresentOrElse(
                        token -> {
                            int deleted = refreshTokenRepository.deleteByUserIdAndTokenHash(
                                    claims.userId(), token.getTokenHash());
                            log.debug("Revoked {} refresh token record(s) for user {}", deleted, claims.userId());
                        },
                        () -> log.debug("No stored refresh token matched for user {}", claims.userId()));
    }
}
