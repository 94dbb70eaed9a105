package com.ariia.security.token;

import com.ariia.security.AuthErrorCode;
import com.ariia.security.AuthException;
import com.ariia.security.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenCodec")
class TokenCodecTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final TokenSettings SETTINGS = TokenSettings.withSecret("unit-test-signing-secret");
    private static final TokenSubject SUBJECT =
            new TokenSubject(42L, "ops@acme.test", 2L, "acme", Role.TENANT_USER);

    private final TokenCodec codec = codecAt(NOW);

    private static TokenCodec codecAt(Instant instant) {
        return new TokenCodec(SETTINGS, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static String b64(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private static AuthErrorCode codeOf(Throwable e) {
        return ((AuthException) e).code();
    }

    @Nested
    @DisplayName("issue()")
    class Issue {

        @Test
        @DisplayName("uses the default 12 hour lifetime and a fresh jti")
        void defaultLifetime() {
            IssuedToken first = codec.issue(SUBJECT);
            IssuedToken second = codec.issue(SUBJECT);

            assertThat(first.payload().expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(12)));
            assertThat(first.payload().jti()).isNotBlank().isNotEqualTo(second.payload().jti());
            assertThat(first.payload().impersonation()).isNull();
        }

        @Test
        @DisplayName("clamps requested lifetimes to [60s, maxTtl]")
        void clampsTtl() {
            assertThat(codec.issue(SUBJECT, Duration.ofSeconds(5), null).payload().expiresAt())
                    .isEqualTo(NOW.plusSeconds(60));
            assertThat(codec.issue(SUBJECT, Duration.ofDays(3), null).payload().expiresAt())
                    .isEqualTo(NOW.plus(Duration.ofHours(12)));
        }

        @Test
        @DisplayName("produces payload.signature with base64url segments and no padding")
        void wireShape() {
            String token = codec.issue(SUBJECT).token();
            assertThat(token.split("\\.")).hasSize(2);
            assertThat(token).doesNotContain("=").doesNotContain("+").doesNotContain("/");
        }

        @Test
        @DisplayName("serializes claims with sorted keys and sub as a string")
        void deterministicJson() {
            TokenPayload payload = new TokenPayload(42L, "ops@acme.test", 2L, "acme", Role.TENANT_USER,
                    Instant.ofEpochSecond(1_900_000_000L), "jti-1", null);
            String body = codec.encode(payload).split("\\.")[0];
            String json = new String(Base64.getUrlDecoder().decode(body), StandardCharsets.UTF_8);

            assertThat(json).isEqualTo("{\"email\":\"ops@acme.test\",\"exp\":1900000000,\"jti\":\"jti-1\","
                    + "\"role\":\"tenant_user\",\"sub\":\"42\",\"tenant_id\":2,\"tenant_slug\":\"acme\"}");
            assertThat(codec.encode(payload)).isEqualTo(codec.encode(payload));
        }
    }

    @Nested
    @DisplayName("decode()")
    class Decode {

        @Test
        @DisplayName("round-trips a plain payload")
        void roundTrip() {
            IssuedToken issued = codec.issue(SUBJECT);
            assertThat(codec.decode(issued.token())).isEqualTo(issued.payload());
        }

        @Test
        @DisplayName("round-trips a hand-built payload whose expiry has a fraction of a second")
        void roundTripSubSecondExpiry() {
            TokenPayload payload = new TokenPayload(42L, "ops@acme.test", 2L, "acme", Role.TENANT_USER,
                    NOW.plusSeconds(600).plusMillis(750), "jti-frac", null);

            assertThat(payload.expiresAt()).isEqualTo(NOW.plusSeconds(600));
            assertThat(codec.decode(codec.encode(payload))).isEqualTo(payload);
        }

        @Test
        @DisplayName("round-trips an impersonation claim")
        void roundTripImpersonation() {
            var claim = new ImpersonationClaim(true, 1L, "root@ariia.test", Role.SYSTEM_ADMIN, 1L, "system",
                    "support ticket #42", NOW);
            IssuedToken issued = codec.issue(SUBJECT, Duration.ofMinutes(45), claim);

            TokenPayload decoded = codec.decode(issued.token());
            assertThat(decoded).isEqualTo(issued.payload());
            assertThat(decoded.isImpersonation()).isTrue();
        }

        @Test
        @DisplayName("rejects any single changed byte in either segment with INVALID_SIGNATURE")
        void tamperedBytes() {
            String token = codec.issue(SUBJECT).token();
            int separator = token.indexOf('.');
            for (int i = 0; i < token.length(); i++) {
                if (i == separator) {
                    continue;
                }
                char[] chars = token.toCharArray();
                chars[i] = chars[i] == 'A' ? 'B' : 'A';
                String tampered = new String(chars);
                assertThatThrownBy(() -> codec.decode(tampered))
                        .as("byte %d", i)
                        .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.INVALID_SIGNATURE));
            }
        }

        @Test
        @DisplayName("rejects a token signed with another secret")
        void otherSecret() {
            var other = new TokenCodec(TokenSettings.withSecret("another-secret"), Clock.fixed(NOW, ZoneOffset.UTC));
            String token = other.issue(SUBJECT).token();
            assertThatThrownBy(() -> codec.decode(token))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.INVALID_SIGNATURE));
        }

        @Test
        @DisplayName("rejects an expired token with a valid signature as EXPIRED")
        void expired() {
            String token = codec.issue(SUBJECT, Duration.ofMinutes(5), null).token();
            TokenCodec later = codecAt(NOW.plus(Duration.ofMinutes(5)).plusSeconds(1));
            assertThatThrownBy(() -> later.decode(token))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.EXPIRED));
        }

        @Test
        @DisplayName("accepts a token at the exact second of expiry")
        void expiryBoundary() {
            IssuedToken issued = codec.issue(SUBJECT, Duration.ofMinutes(5), null);
            assertThat(codecAt(NOW.plus(Duration.ofMinutes(5))).decode(issued.token())).isEqualTo(issued.payload());
        }

        @Test
        @DisplayName("rejects role 'superuser' with INVALID_ROLE despite a valid signature")
        void unknownRole() {
            String token = codec.encodeRaw(b64("{\"email\":\"x@y.z\",\"exp\":1900000000,\"jti\":\"j\","
                    + "\"role\":\"superuser\",\"sub\":\"1\",\"tenant_id\":1,\"tenant_slug\":\"t\"}"));
            assertThatThrownBy(() -> codec.decode(token))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.INVALID_ROLE));
        }

        @Test
        @DisplayName("rejects an unknown actor role inside the impersonation claim with INVALID_ROLE")
        void unknownActorRole() {
            String token = codec.encodeRaw(b64("{\"email\":\"x@y.z\",\"exp\":1900000000,\"imp\":{\"active\":true,"
                    + "\"actor_role\":\"root\",\"actor_user_id\":1},\"jti\":\"j\",\"role\":\"tenant_user\","
                    + "\"sub\":\"1\",\"tenant_id\":1,\"tenant_slug\":\"t\"}"));
            assertThatThrownBy(() -> codec.decode(token))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.INVALID_ROLE));
        }

        @Test
        @DisplayName("rejects signed but structurally invalid payloads as MALFORMED")
        void malformedPayloads() {
            assertThatThrownBy(() -> codec.decode(codec.encodeRaw(b64("not json"))))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.MALFORMED));
            assertThatThrownBy(() -> codec.decode(codec.encodeRaw(b64("[1,2]"))))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.MALFORMED));
            assertThatThrownBy(() -> codec.decode(codec.encodeRaw(b64("{\"role\":\"tenant_user\",\"exp\":1900000000}"))))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.MALFORMED));
            assertThatThrownBy(() -> codec.decode(codec.encodeRaw("***")))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.MALFORMED));
        }

        @Test
        @DisplayName("rejects empty and separator-less tokens as MALFORMED")
        void structural() {
            assertThatThrownBy(() -> codec.decode(""))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.MALFORMED));
            assertThatThrownBy(() -> codec.decode("abcdef"))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(AuthErrorCode.MALFORMED));
        }
    }

    @Nested
    @DisplayName("TokenSettings")
    class Settings {

        @Test
        @DisplayName("rejects a blank secret")
        void blankSecret() {
            assertThatThrownBy(() -> TokenSettings.withSecret(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("defaults to 12h sessions and 45 min impersonation")
        void defaults() {
            assertThat(SETTINGS.defaultTtl()).isEqualTo(Duration.ofHours(12));
            assertThat(SETTINGS.maxTtl()).isEqualTo(Duration.ofHours(12));
            assertThat(SETTINGS.impersonationTtl()).isEqualTo(Duration.ofMinutes(45));
            assertThat(SETTINGS.toString()).doesNotContain("unit-test-signing-secret");
        }

        @Test
        @DisplayName("rejects an impersonation lifetime that is not shorter than a session")
        void impersonationNotShorter() {
            assertThatThrownBy(() -> new TokenSettings("s", Duration.ofHours(1), null, Duration.ofHours(2)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
