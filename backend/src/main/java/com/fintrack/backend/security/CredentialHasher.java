package com.fintrack.backend.security;

import com.fintrack.backend.config.SecurityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCrypt;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way bcrypt hashing for passwords and refresh tokens.
 * <p>
 * Passwords and tokens use separate work factors. Tokens are digested with
 * SHA-256 before bcrypt because bcrypt ignores everything past 72 bytes, and two
 * JWTs for the same user share a much longer prefix than that.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialHasher {

    private static final int MIN_WORK_FACTOR = 4;
    private static final int MAX_WORK_FACTOR = 31;
    private static final int MAX_INPUT_BYTES = 72;

    private final SecurityProperties securityProperties;

    public String hash(String secret, int workFactor) {
        requireSecret(secret);
        if (workFactor < MIN_WORK_FACTOR || workFactor > MAX_WORK_FACTOR) {
            throw new IllegalArgumentException("Work factor must be between 4 and 31, got " + workFactor);
        }
        return BCrypt.hashpw(secret, BCrypt.gensalt(workFactor));
    }

    public boolean verify(String secret, String hashedValue) {
        requireSecret(secret);
        if (hashedValue == null || hashedValue.isBlank()) {
            return false;
        }
        try {
            return BCrypt.checkpw(secret, hashedValue);
        } catch (IllegalArgumentException ex) {
            log.warn("Stored hash is not a valid bcrypt value: {}", ex.getMessage());
            return false;
        }
    }

    public String hashPassword(String password) {
        return hash(password, securityProperties.getPasswordWorkFactor());
    }

    public String hashToken(String rawToken) {
        return hash(digest(rawToken), securityProperties.getTokenWorkFactor());
    }

    public boolean verifyToken(String rawToken, String hashedValue) {
        return verify(digest(rawToken), hashedValue);
    }

    private void requireSecret(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret to hash must not be empty");
        }
        if (secret.getBytes(StandardCharsets.UTF_8).length > MAX_INPUT_BYTES) {
            throw new IllegalArgumentException("Secret to hash must not exceed 72 bytes");
        }
    }

    private String digest(String rawToken) {
        if (rawToken == null || rawToken.isEmpty()) {
            throw new IllegalArgumentException("Token to hash must not be empty");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
