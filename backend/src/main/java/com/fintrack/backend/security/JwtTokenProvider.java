package com.fintrack.backend.security;

import com.fintrack.backend.config.JwtProperties;
import com.fintrack.backend.exception.InvalidTokenException;
import com.fintrack.backend.model.UserAccount;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies the HS256 access and refresh tokens.
 * <p>
 * Access tokens are stateless: signature and expiry decide validity. Refresh
 * tokens carry {@code type=refresh} and a unique {@code jti}; they are only
 * honoured while their hash is also on record (see RefreshTokenService).
 * <p>
 * The application refuses to start without a signing secret of at least 32 bytes.
 */
@Slf4j
@Component
public class JwtTokenProvider {

    public static final String TYPE_CLAIM = "type";
    public static final String REFRESH_TYPE = "refresh";
    public static final String EMAIL_CLAIM = "email";
    public static final String FIRST_NAME_CLAIM = "firstName";
    public static final String LAST_NAME_CLAIM = "lastName";

    private static final int MIN_SECRET_BYTES = 32;

    private final JwtProperties jwtProperties;
    private final Clock clock;
    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public JwtTokenProvider(JwtProperties jwtProperties, Clock clock) {
        this.jwtProperties = jwtProperties;
        this.clock = clock;
        this.accessKey = signingKey(jwtProperties.getSecret(), "JWT_SECRET");
        if (jwtProperties.hasDedicatedRefreshSecret()) {
            this.refreshKey = signingKey(jwtProperties.getRefreshSecret(), "JWT_REFRESH_SECRET");
        } else {
            log.warn("No dedicated refresh token secret configured; access and refresh tokens share one signing key");
            this.refreshKey = accessKey;
        }
    }

    private static SecretKey signingKey(String secret, String variable) {
        if (secret == null || secret.isBlank()) {
            String reason = "Missing JWT secret. Set " + variable + " environment variable.";
            log.error(reason);
            throw new IllegalStateException(reason);
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            String reason = variable + " must be at least 32 bytes.";
            log.error(reason);
            throw new IllegalStateException(reason);
        }
        return Keys.hmacShaKeyFor(keyBytes);
    }

    public String generateAccessToken(UserAccount user) {
        Instant now = clock.instant();
        Instant expiry = now.plus(jwtProperties.getAccessTokenTtl());

        return Jwts.builder()
                .subject(user.getId().toString())
                .claim(EMAIL_CLAIM, user.getEmail())
                .claim(FIRST_NAME_CLAIM, user.getFirstName())
                .claim(LAST_NAME_CLAIM, user.getLastName())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(accessKey, Jwts.SIG.HS256)
                .compact();
    }

    public String generateRefreshToken(UUID userId) {
        Instant now = clock.instant();
        Instant expiry = now.plus(jwtProperties.getRefreshTokenTtl());

        return Jwts.builder()
                .subject(userId.toString())
                .id(UUID.randomUUID().toString())
                .claim(TYPE_CLAIM, REFRESH_TYPE)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(refreshKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * @throws InvalidTokenException on bad signature, malformed token, expiry,
     *                               or when a refresh token is presented
     */
    public AccessTokenClaims parseAccessToken(String token) {
        Claims claims = parse(token, accessKey);
        if (REFRESH_TYPE.equals(claims.get(TYPE_CLAIM, String.class))) {
            throw new InvalidTokenException("Refresh token presented as access token");
        }
        return new AccessTokenClaims(
                subject(claims),
                claims.get(EMAIL_CLAIM, String.class),
                claims.get(FIRST_NAME_CLAIM, String.class),
                claims.get(LAST_NAME_CLAIM, String.class),
                instant(claims.getIssuedAt(), "iat"),
                instant(claims.getExpiration(), "exp"));
    }

    /**
     * @throws InvalidTokenException on bad signature, malformed token, expiry,
     *                               or a missing/foreign type claim
     */
    public RefreshTokenClaims parseRefreshToken(String token) {
        Claims claims = parse(token, refreshKey);
        if (!REFRESH_TYPE.equals(claims.get(TYPE_CLAIM, String.class))) {
            throw new InvalidTokenException("Token is not a refresh token");
        }
        return new RefreshTokenClaims(
                subject(claims),
                claims.getId(),
                instant(claims.getIssuedAt(), "iat"),
                instant(claims.getExpiration(), "exp"));
    }

    private Claims parse(String token, SecretKey key) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }
        try {
            return Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException ex) {
            throw new InvalidTokenException("JWT validation error: " + ex.getMessage(), ex);
        }
    }

    private Instant instant(Date value, String claim) {
        if (value == null) {
            throw new InvalidTokenException("Token has no " + claim + " claim");
        }
        return value.toInstant();
    }

    private UUID subject(Claims claims) {
        String subject = claims.getSubject();
        if (subject == null) {
            throw new InvalidTokenException("Token has no subject");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException ex) {
            throw new InvalidTokenException("Token subject is not a user id", ex);
        }
    }
}
