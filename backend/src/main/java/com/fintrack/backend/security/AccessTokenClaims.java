package com.fintrack.backend.security;

import java.time.Instant;
import java.util.UUID;

public record AccessTokenClaims(
        UUID userId,
        String email,
        String firstName,
        String lastName,
        Instant issuedAt,
        Instant expiresAt
) {
}
