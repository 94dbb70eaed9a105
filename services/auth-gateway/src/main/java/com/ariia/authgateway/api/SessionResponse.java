package com.ariia.authgateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Returned whenever a token is issued. {@code mode} is {@code ghost} for an impersonation session,
 * {@code normal} after one ends, absent for a sign-in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        String status,
        String mode,
        String accessToken,
        String tokenType,
        UserView user) {

    public static final String TOKEN_TYPE = "bearer";

    public static SessionResponse login(String accessToken, UserView user) {
        return new SessionResponse(null, null, accessToken, TOKEN_TYPE, user);
    }

    public static SessionResponse ghost(String accessToken, UserView user) {
        return new SessionResponse("ok", "ghost", accessToken, TOKEN_TYPE, user);
    }

    public static SessionResponse normal(String accessToken, UserView user) {
        return new SessionResponse("ok", "normal", accessToken, TOKEN_TYPE, user);
    }

    @Override
    public String toString() {
        return "SessionResponse[status=%s, mode=%s, accessToken=***, user=%s]".formatted(status, mode, user);
    }
}
