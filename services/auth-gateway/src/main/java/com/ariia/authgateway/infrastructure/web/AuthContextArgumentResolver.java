package com.ariia.authgateway.infrastructure.web;

import com.ariia.observability.CorrelationContextHolder;
import com.ariia.security.AuthContext;
import com.ariia.security.AuthenticationService;
import com.ariia.security.RequestCredentials;
import com.ariia.security.legacy.LegacyFallbackResolver;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies a resolved {@link AuthContext} to any controller method that declares one.
 *
 * <p>Resolution failures propagate as {@code AuthException} and become 401 responses. On success
 * the tenant, user and impersonating operator are added to the logging MDC.
 */
@Component
public class AuthContextArgumentResolver implements HandlerMethodArgumentResolver {

    private final AuthenticationService authenticationService;

    public AuthContextArgumentResolver(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthContext.class.equals(parameter.getParameterType());
    }

    @Override
    public AuthContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        AuthContext context = authenticationService.resolve(credentials(request));
        CorrelationContextHolder.attachPrincipal(
                Long.toString(context.tenantId()),
                Long.toString(context.userId()),
                context.isImpersonating() ? Long.toString(context.impersonator().userId()) : null);
        return context;
    }

    @SuppressWarnings("deprecation")
    static RequestCredentials credentials(HttpServletRequest request) {
        return new RequestCredentials(
                request.getHeader(HttpHeaders.AUTHORIZATION),
                cookieValue(request, AuthCookies.ACCESS_COOKIE),
                request.getHeader(LegacyFallbackResolver.USER_ID_HEADER),
                request.getHeader(LegacyFallbackResolver.TENANT_ID_HEADER),
                request.getHeader(LegacyFallbackResolver.ROLE_HEADER));
    }

    public static String cookieValue(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }
}
