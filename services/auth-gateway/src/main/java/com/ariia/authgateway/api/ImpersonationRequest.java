package com.ariia.authgateway.api;

import jakarta.validation.constraints.NotNull;

/** Body of {@code POST /users/{id}/impersonate}. The reason length is checked after trimming. */
public record ImpersonationRequest(@NotNull String reason) {
}
