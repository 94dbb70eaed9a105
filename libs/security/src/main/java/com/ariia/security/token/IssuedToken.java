package com.ariia.security.token;

/**
 * A freshly signed token together with the claims it carries.
 *
 * @param token   wire form, {@code payload.signature}
 * @param payload claims inside {@code token}
 */
public record IssuedToken(String token, TokenPayload payload) {

    /** Keeps the credential out of logs. */
    @Override
    public String toString() {
        return "IssuedToken[jti=%s, sub=%d, exp=%s]"
                .formatted(payload.jti(), payload.subject(), payload.expiresAt());
    }
}
