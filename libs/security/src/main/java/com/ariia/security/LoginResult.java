package com.ariia.security;

import com.ariia.security.token.IssuedToken;

/**
 * Outcome of a successful sign-in.
 *
 * @param token   freshly issued session token
 * @param context resolved identity bound to {@code token}
 */
public record LoginResult(IssuedToken token, AuthContext context) {
}
