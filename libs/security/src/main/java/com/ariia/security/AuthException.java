package com.ariia.security;

/**
 * Typed rejection raised by the auth core.
 * <p>
 * Unchecked: none of these conditions is retried internally. They are either permanent (bad
 * signature) or need caller action (sign in again, pick another target). The {@link #code()}
 * decides the response class; {@link #userMessage()} is safe to show to the caller while
 * {@link #getMessage()} may carry internal detail for logs.
 */
public class AuthException extends RuntimeException {

    private final AuthErrorCode code;
    private final String userMessage;

    public AuthException(AuthErrorCode code, String detail) {
        this(code, detail, code.defaultMessage());
    }

    public AuthException(AuthErrorCode code, String detail, String userMessage) {
        super(code + ": " + detail);
        this.code = code;
        this.userMessage = userMessage;
    }

    /** Session-level rejection: the caller only ever sees "session invalid". */
    public static AuthException unauthenticated(AuthErrorCode code, String detail) {
        return new AuthException(code, detail);
    }

    /** Rejection whose message is shown to the operator as-is. */
    public static AuthException actionable(AuthErrorCode code, String message) {
        return new AuthException(code, message, message);
    }

    public AuthErrorCode code() {
        return code;
    }

    public String userMessage() {
        return userMessage;
    }
}
