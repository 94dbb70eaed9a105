package com.ariia.authgateway.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /login}. */
public record LoginRequest(
        @NotBlank @Size(min = 3, max = 254) String email,
        @NotNull String password) {

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + ", password=***]";
    }
}
