package com.fintrack.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Outward-facing authentication failures. Each code carries the only message a
 * caller ever sees; the detailed cause stays in the logs.
 */
public enum AuthErrorCode {

    DUPLICATE_EMAIL(HttpStatus.CONFLICT, "User with this email already exists"),
    CREATE_FAILED(HttpStatus.BAD_REQUEST, "Failed to create user"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid credentials"),
    INVALID_REFRESH_TOKEN(HttpStatus.UNAUTHORIZED, "Token refresh failed"),
    LOGOUT_FAILED(HttpStatus.UNAUTHORIZED, "Logout failed"),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "JWT missing/expired");

    private final HttpStatus status;
    private final String publicMessage;

    AuthErrorCode(HttpStatus status, String publicMessage) {
        this.status = status;
        this.publicMessage = publicMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getPublicMessage() {
        return publicMessage;
    }
}
