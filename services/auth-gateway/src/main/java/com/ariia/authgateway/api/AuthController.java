package com.ariia.authgateway.api;

import com.ariia.authgateway.application.SessionRevocationService;
import com.ariia.authgateway.infrastructure.web.AuthContextArgumentResolver;
import com.ariia.authgateway.infrastructure.web.AuthCookies;
import com.ariia.security.AuthContext;
import com.ariia.security.AuthenticationService;
import com.ariia.security.BearerTokenExtractor;
import com.ariia.security.LoginResult;
import com.ariia.security.token.IssuedToken;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session endpoints of the gateway.
 *
 * <p>Every endpoint that issues a token returns it in the body and in the session cookies, so
 * both API clients and browsers can use it. Endpoints taking an {@link AuthContext} require a
 * resolvable session.
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthenticationService authenticationService;
    private final SessionRevocationService sessionRevocationService;
    private final AuthCookies authCookies;

    public AuthController(
            AuthenticationService authenticationService,
            SessionRevocationService sessionRevocationService,
            AuthCookies authCookies) {
        this.authenticationService = authenticationService;
        this.sessionRevocationService = sessionRevocationService;
        this.authCookies = authCookies;
    }

    @PostMapping("/login")
    public ResponseEntity<SessionResponse> login(@Valid @RequestBody LoginRequest request) {
        LoginResult result = authenticationService.login(request.email(), request.password());
        return withCookies(result.token(), SessionResponse.login(result.token().token(), UserView.of(result.context())));
    }

    /** Revokes the presented token, if any, and clears the cookies. Always 204. */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest request) {
        String rawToken = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION))
                .orElseGet(() -> AuthContextArgumentResolver.cookieValue(request, AuthCookies.ACCESS_COOKIE));
        authenticationService.logout(rawToken);
        HttpHeaders headers = new HttpHeaders();
        authCookies.clear(headers);
        return ResponseEntity.noContent().headers(headers).build();
    }

    @GetMapping("/me")
    public UserView me(AuthContext context) {
        return UserView.of(context);
    }

    @PostMapping("/users/{userId}/impersonate")
    public ResponseEntity<SessionResponse> startImpersonation(
            AuthContext context, @PathVariable long userId, @Valid @RequestBody ImpersonationRequest request) {
        IssuedToken token = authenticationService.startImpersonation(context, userId, request.reason());
        return withCookies(token, SessionResponse.ghost(token.token(), UserView.of(token.payload())));
    }

    @PostMapping("/impersonation/stop")
    public ResponseEntity<SessionResponse> stopImpersonation(AuthContext context) {
        IssuedToken token = authenticationService.stopImpersonation(context);
        return withCookies(token, SessionResponse.normal(token.token(), UserView.of(token.payload())));
    }

    @PostMapping("/users/{userId}/revoke-sessions")
    public RevokeSessionsResponse revokeSessions(AuthContext context, @PathVariable long userId) {
        SessionRevocationService.Result result = sessionRevocationService.revokeAllSessions(context, userId);
        return new RevokeSessionsResponse(result.userId(), result.tenantId(), result.revoked());
    }

    private ResponseEntity<SessionResponse> withCookies(IssuedToken token, SessionResponse body) {
        HttpHeaders headers = new HttpHeaders();
        authCookies.write(headers, token);
        return ResponseEntity.ok().headers(headers).body(body);
    }
}
