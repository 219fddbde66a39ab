package com.fintrack.backend.exception;

/**
 * Failure of an authentication flow. {@link #getMessage()} is safe to return to
 * clients; the wrapped cause is for logging only.
 */
public class AuthException extends RuntimeException {

    private final AuthErrorCode code;

    public AuthException(AuthErrorCode code) {
        this(code, code.getPublicMessage(), null);
    }

    public AuthException(AuthErrorCode code, Throwable cause) {
        this(code, code.getPublicMessage(), cause);
    }

    public AuthException(AuthErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public AuthErrorCode getCode() {
        return code;
    }
}
