package com.fintrack.backend.service;

import com.fintrack.backend.dto.AuthResponse;
import com.fintrack.backend.dto.AuthUserDTO;
import com.fintrack.backend.dto.RefreshResponse;
import com.fintrack.backend.dto.SignInRequest;
import com.fintrack.backend.dto.SignUpRequest;
import com.fintrack.backend.exception.AuthErrorCode;
import com.fintrack.backend.exception.AuthException;
import com.fintrack.backend.exception.InvalidTokenException;
import com.fintrack.backend.model.UserAccount;
import com.fintrack.backend.repository.UserRepository;
import com.fintrack.backend.security.AccessTokenClaims;
import com.fintrack.backend.security.CredentialHasher;
import com.fintrack.backend.security.JwtTokenProvider;
import com.fintrack.backend.security.RefreshTokenClaims;
import com.fintrack.backend.security.UserPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Signup, signin, refresh-token rotation and logout.
 * <p>
 * Signin and refresh collapse every failure into one outward error so callers
 * cannot tell an unknown account from a wrong password, or a forged refresh
 * token from a rotated one. The detailed cause is logged only.
 * <p>
 * Nothing here locks. The users.email unique constraint decides concurrent
 * signups, and concurrent refreshes of one token leave the last stored token
 * as the only one that validates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;
    private final JwtTokenProvider jwtTokenProvider;
    private final RefreshTokenService refreshTokenService;

    public AuthResponse signUp(SignUpRequest request) {
        String passwordHash;
        try {
            passwordHash = credentialHasher.hashPassword(request.getPassword());
        } catch (IllegalArgumentException ex) {
            log.warn("Signup rejected: password cannot be hashed: {}", ex.getMessage());
            throw new AuthException(AuthErrorCode.CREATE_FAILED, ex);
        }

        // the unique constraint is authoritative; this only avoids a failed insert
        if (userRepository.existsByEmail(request.getEmail())) {
            log.info("Signup rejected: email already registered");
            throw new AuthException(AuthErrorCode.DUPLICATE_EMAIL);
        }

        UserAccount user = insertUser(request, passwordHash);
        log.info("Created user {}", user.getId());
        try {
            return issueSession(user);
        } catch (RuntimeException ex) {
            // the account stays; signin can open a session later
            log.error("User {} was created but no session could be issued", user.getId(), ex);
            throw new AuthException(AuthErrorCode.CREATE_FAILED, ex);
        }
    }

    public AuthResponse signIn(SignInRequest request) {
        try {
            UserAccount user = userRepository.findByEmail(request.getEmail())
                    .orElseThrow(() -> new InvalidCredentialsCause("no user with this email"));
            if (!credentialHasher.verify(request.getPassword(), user.getPasswordHash())) {
                throw new InvalidCredentialsCause("password mismatch");
            }
            AuthResponse response = issueSession(user);
            log.info("User {} signed in", user.getId());
            return response;
        } catch (RuntimeException ex) {
            log.warn("Signin failed: {}", ex.getMessage());
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS, ex);
        }
    }

    public RefreshResponse refresh(String rawRefreshToken) {
        try {
            RefreshTokenClaims claims = jwtTokenProvider.parseRefreshToken(rawRefreshToken);
            if (!refreshTokenService.validate(claims.userId(), rawRefreshToken)) {
                throw new InvalidTokenException("Refresh token is not on record for user " + claims.userId());
            }
            UserAccount user = userRepository.findById(claims.userId())
                    .orElseThrow(() -> new InvalidTokenException("Refresh token subject no longer exists"));

            String accessToken = jwtTokenProvider.generateAccessToken(user);
            String newRefreshToken = jwtTokenProvider.generateRefreshToken(user.getId());

            // rotation point: the new record replaces the old one
            refreshTokenService.storeToken(user.getId(), newRefreshToken);
            refreshTokenService.revokeToken(rawRefreshToken);

            log.debug("Rotated refresh token for user {}", user.getId());
            return new RefreshResponse(accessToken, newRefreshToken);
        } catch (RuntimeException ex) {
            log.warn("Token refresh rejected: {}", ex.getMessage());
            throw new AuthException(AuthErrorCode.INVALID_REFRESH_TOKEN, ex);
        }
    }

    /**
     * Idempotent for well-formed tokens: a token already rotated or logged out
     * succeeds without deleting anything.
     */
    public void logout(String rawRefreshToken) {
        try {
            refreshTokenService.revokeToken(rawRefreshToken);
        } catch (RuntimeException ex) {
            log.warn("Logout failed: {}", ex.getMessage());
            throw new AuthException(AuthErrorCode.LOGOUT_FAILED, ex);
        }
    }

    public UserPrincipal validateAccessToken(String accessToken) {
        try {
            AccessTokenClaims claims = jwtTokenProvider.parseAccessToken(accessToken);
            return userRepository.findById(claims.userId())
                    .map(UserPrincipal::from)
                    .orElseThrow(() -> new InvalidTokenException("Access token subject no longer exists"));
        } catch (RuntimeException ex) {
            log.debug("Access token rejected: {}", ex.getMessage());
            throw new AuthException(AuthErrorCode.UNAUTHENTICATED, ex);
        }
    }

    private UserAccount insertUser(SignUpRequest request, String passwordHash) {
        UserAccount candidate = UserAccount.builder()
                .email(request.getEmail())
                .passwordHash(passwordHash)
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .build();
        try {
            return userRepository.saveAndFlush(candidate);
        } catch (DataIntegrityViolationException ex) {
            if (userRepository.existsByEmail(request.getEmail())) {
                log.info("Signup lost a concurrent insert for the same email");
                throw new AuthException(AuthErrorCode.DUPLICATE_EMAIL, ex);
            }
            log.error("Signup insert rejected by storage", ex);
            throw createFailed(ex);
        } catch (DataAccessException ex) {
            log.error("Signup insert failed", ex);
            throw createFailed(ex);
        }
    }

    private AuthException createFailed(DataAccessException ex) {
        return new AuthException(AuthErrorCode.CREATE_FAILED,
                "Failed to create user: " + ex.getMostSpecificCause().getMessage(), ex);
    }

    private AuthResponse issueSession(UserAccount user) {
        String accessToken = jwtTokenProvider.generateAccessToken(user);
        String refreshToken = jwtTokenProvider.generateRefreshToken(user.getId());
        refreshTokenService.storeToken(user.getId(), refreshToken);
        return AuthResponse.builder()
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .user(AuthUserDTO.from(user))
                .build();
    }

    private static final class InvalidCredentialsCause extends RuntimeException {
        private InvalidCredentialsCause(String message) {
            super(message);
        }
    }
}
