package com.ariia.security;

/**
 * Every way the auth core can reject a request.
 * <p>
 * All {@link Status#UNAUTHENTICATED} codes except {@link #INVALID_CREDENTIALS} share one
 * user-facing message so a client cannot tell a forged token from an expired or revoked one.
 */
public enum AuthErrorCode {

    MISSING_CREDENTIALS(Status.UNAUTHENTICATED),
    MALFORMED(Status.UNAUTHENTICATED),
    INVALID_SIGNATURE(Status.UNAUTHENTICATED),
    EXPIRED(Status.UNAUTHENTICATED),
    INVALID_ROLE(Status.UNAUTHENTICATED),
    REVOKED(Status.UNAUTHENTICATED),
    PRINCIPAL_NOT_FOUND(Status.UNAUTHENTICATED),
    TENANT_INACTIVE(Status.UNAUTHENTICATED),
    INVALID_CREDENTIALS(Status.UNAUTHENTICATED),
    FORBIDDEN(Status.FORBIDDEN),
    CONFLICT(Status.CONFLICT),
    INVALID_TARGET(Status.UNPROCESSABLE);

    /** Message shown for every session-level rejection. */
    public static final String SESSION_INVALID_MESSAGE = "Session invalid, please sign in again";

    /** Status class used by transports to pick a response code. */
    public enum Status {
        UNAUTHENTICATED(401),
        FORBIDDEN(403),
        CONFLICT(409),
        UNPROCESSABLE(422);

        private final int httpStatus;

        Status(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    private final Status status;

    AuthErrorCode(Status status) {
        this.status = status;
    }

    public Status status() {
        return status;
    }

    /**
     * Default message for this code. Throw sites for FORBIDDEN, CONFLICT and INVALID_TARGET
     * normally supply a more specific one.
     */
    public String defaultMessage() {
        return switch (this) {
            case INVALID_CREDENTIALS -> "Invalid credentials";
            case FORBIDDEN -> "Insufficient role";
            case CONFLICT -> "Request conflicts with the current session state";
            case INVALID_TARGET -> "Invalid target";
            default -> SESSION_INVALID_MESSAGE;
        };
    }
}
