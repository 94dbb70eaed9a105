package com.ariia.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthException")
class AuthExceptionTest {

    @ParameterizedTest
    @EnumSource(value = AuthErrorCode.class,
            names = {"MISSING_CREDENTIALS", "MALFORMED", "INVALID_SIGNATURE", "EXPIRED", "INVALID_ROLE",
                    "REVOKED", "PRINCIPAL_NOT_FOUND", "TENANT_INACTIVE"})
    @DisplayName("session failures all show the same message and map to 401")
    void sessionFailuresLookAlike(AuthErrorCode code) {
        var e = AuthException.unauthenticated(code, "internal detail");
        assertThat(e.userMessage()).isEqualTo(AuthErrorCode.SESSION_INVALID_MESSAGE);
        assertThat(e.code().status().httpStatus()).isEqualTo(401);
        assertThat(e.getMessage()).contains("internal detail");
    }

    @Test
    @DisplayName("actionable failures keep their message")
    void actionableMessage() {
        var e = AuthException.actionable(AuthErrorCode.CONFLICT, "Already in impersonation mode");
        assertThat(e.userMessage()).isEqualTo("Already in impersonation mode");
        assertThat(e.code().status().httpStatus()).isEqualTo(409);
    }

    @Test
    @DisplayName("status classes map to 403 and 422")
    void statusClasses() {
        assertThat(AuthErrorCode.FORBIDDEN.status().httpStatus()).isEqualTo(403);
        assertThat(AuthErrorCode.INVALID_TARGET.status().httpStatus()).isEqualTo(422);
        assertThat(AuthErrorCode.INVALID_CREDENTIALS.defaultMessage()).isEqualTo("Invalid credentials");
    }
}
