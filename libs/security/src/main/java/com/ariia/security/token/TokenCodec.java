package com.ariia.security.token;

import com.ariia.security.AuthErrorCode;
import com.ariia.security.AuthException;
import com.ariia.security.Role;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Issues and verifies signed session tokens.
 * <p>
 * Wire form is {@code base64url(json).base64url(hmacSha256(secret, base64url(json)))}, both
 * segments without padding. The JSON is compact with sorted keys so the same claims always
 * produce the same bytes.
 * <p>
 * Verification order is fixed: the signature is checked before the payload is parsed, so an
 * unsigned payload is never interpreted. Thread-safe.
 */
public final class TokenCodec {

    /** Shortest lifetime a caller can request. */
    public static final Duration MIN_TTL = Duration.ofSeconds(60);

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SecretKeySpec signingKey;
    private final TokenSettings settings;
    private final Clock clock;

    public TokenCodec(TokenSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.signingKey = new SecretKeySpec(settings.secret().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    public TokenSettings settings() {
        return settings;
    }

    /** Issues a normal session token with the default lifetime. */
    public IssuedToken issue(TokenSubject subject) {
        return issue(subject, settings.defaultTtl(), null);
    }

    /**
     * Issues a token for {@code subject}.
     *
     * @param ttl           requested lifetime, clamped to [{@link #MIN_TTL}, maxTtl]; null means default
     * @param impersonation {@code imp} claim to embed, or null
     */
    public IssuedToken issue(TokenSubject subject, Duration ttl, ImpersonationClaim impersonation) {
        Duration effective = clamp(ttl == null ? settings.defaultTtl() : ttl);
        Instant expiresAt = Instant.ofEpochSecond(clock.instant().getEpochSecond() + effective.toSeconds());
        TokenPayload payload = new TokenPayload(
                subject.userId(),
                subject.email(),
                subject.tenantId(),
                subject.tenantSlug(),
                subject.role(),
                expiresAt,
                UUID.randomUUID().toString(),
                impersonation);
        return new IssuedToken(encode(payload), payload);
    }

    /** Signs an explicit payload. */
    public String encode(TokenPayload payload) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(toClaims(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize token payload", e);
        }
        return encodeRaw(ENCODER.encodeToString(json));
    }

    /** Signs an already encoded payload segment. */
    String encodeRaw(String body) {
        return body + "." + sign(body);
    }

    /**
     * Verifies and parses a token.
     *
     * @throws AuthException MALFORMED, INVALID_SIGNATURE, EXPIRED or INVALID_ROLE
     */
    public TokenPayload decode(String token) {
        if (token == null || token.isBlank()) {
            throw AuthException.unauthenticated(AuthErrorCode.MALFORMED, "empty token");
        }
        int separator = token.indexOf('.');
        if (separator < 0) {
            throw AuthException.unauthenticated(AuthErrorCode.MALFORMED, "missing signature segment");
        }
        String body = token.substring(0, separator);
        String signature = token.substring(separator + 1);

        byte[] expected = sign(body).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8))) {
            throw AuthException.unauthenticated(AuthErrorCode.INVALID_SIGNATURE, "signature mismatch");
        }

        JsonNode root = parse(body);
        JsonNode exp = root.get("exp");
        if (exp == null || !exp.isIntegralNumber()) {
            throw malformed("exp");
        }
        if (clock.instant().getEpochSecond() > exp.asLong()) {
            throw AuthException.unauthenticated(AuthErrorCode.EXPIRED, "expired at " + exp.asLong());
        }
        Role role = role(root.get("role"), "role");
        ImpersonationClaim impersonation = impersonation(root.get("imp"));

        return new TokenPayload(
                longValue(root.get("sub"), "sub"),
                text(root.get("email"), "email"),
                longValue(root.get("tenant_id"), "tenant_id"),
                text(root.get("tenant_slug"), "tenant_slug"),
                role,
                Instant.ofEpochSecond(exp.asLong()),
                text(root.get("jti"), "jti"),
                impersonation);
    }

    private Duration clamp(Duration ttl) {
        if (ttl.compareTo(MIN_TTL) < 0) {
            return MIN_TTL;
        }
        if (ttl.compareTo(settings.maxTtl()) > 0) {
            return settings.maxTtl();
        }
        return ttl;
    }

    private String sign(String body) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            return ENCODER.encodeToString(mac.doFinal(body.getBytes(StandardCharsets.US_ASCII)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private JsonNode parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(DECODER.decode(body));
        } catch (IllegalArgumentException | IOException e) {
            throw AuthException.unauthenticated(AuthErrorCode.MALFORMED, "undecodable payload: " + e.getMessage());
        }
        if (root == null || !root.isObject()) {
            throw AuthException.unauthenticated(AuthErrorCode.MALFORMED, "payload is not a JSON object");
        }
        return root;
    }

    private static Map<String, Object> toClaims(TokenPayload payload) {
        Map<String, Object> claims = new TreeMap<>();
        claims.put("sub", Long.toString(payload.subject()));
        claims.put("email", payload.email());
        claims.put("tenant_id", payload.tenantId());
        claims.put("tenant_slug", payload.tenantSlug());
        claims.put("role", payload.role().value());
        claims.put("exp", payload.expiresAt().getEpochSecond());
        claims.put("jti", payload.jti());
        ImpersonationClaim imp = payload.impersonation();
        if (imp != null) {
            Map<String, Object> nested = new TreeMap<>();
            nested.put("active", imp.active());
            nested.put("actor_user_id", imp.actorUserId());
            nested.put("actor_email", imp.actorEmail());
            nested.put("actor_role", imp.actorRole().value());
            nested.put("actor_tenant_id", imp.actorTenantId());
            nested.put("actor_tenant_slug", imp.actorTenantSlug());
            nested.put("reason", imp.reason());
            nested.put("started_at", imp.startedAt().toString());
            claims.put("imp", nested);
        }
        return claims;
    }

    private static ImpersonationClaim impersonation(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw malformed("imp");
        }
        // actor_role is validated even for inactive claims so no unknown role survives decoding
        Role actorRole = role(node.get("actor_role"), "imp.actor_role");
        JsonNode active = node.get("active");
        return new ImpersonationClaim(
                active != null && active.isBoolean() && active.booleanValue(),
                longValue(node.get("actor_user_id"), "imp.actor_user_id"),
                text(node.get("actor_email"), "imp.actor_email"),
                actorRole,
                longValue(node.get("actor_tenant_id"), "imp.actor_tenant_id"),
                text(node.get("actor_tenant_slug"), "imp.actor_tenant_slug"),
                text(node.get("reason"), "imp.reason"),
                instant(node.get("started_at")));
    }

    private static Role role(JsonNode node, String field) {
        Optional<Role> role = node != null && node.isTextual() ? Role.fromString(node.textValue()) : Optional.empty();
        return role.orElseThrow(() -> AuthException.unauthenticated(AuthErrorCode.INVALID_ROLE,
                "%s=%s".formatted(field, node)));
    }

    private static long longValue(JsonNode node, String field) {
        if (node != null && node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node != null && node.isTextual()) {
            try {
                return Long.parseLong(node.textValue());
            } catch (NumberFormatException e) {
                throw malformed(field);
            }
        }
        throw malformed(field);
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.isTextual() || node.textValue().isBlank()) {
            throw malformed(field);
        }
        return node.textValue();
    }

    private static Instant instant(JsonNode node) {
        String value = text(node, "imp.started_at");
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw malformed("imp.started_at");
        }
    }

    private static AuthException malformed(String field) {
        return AuthException.unauthenticated(AuthErrorCode.MALFORMED, "missing or invalid claim " + field);
    }
}
