package com.fintrack.backend.security;

import java.time.Instant;
import java.util.UUID;

public record RefreshTokenClaims(
        UUID userId,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt
) {
}
