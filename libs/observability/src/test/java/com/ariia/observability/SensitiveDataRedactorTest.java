package com.ariia.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SensitiveDataRedactor}: field redaction, case insensitivity,
 * nested maps and custom patterns.
 */
@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("Default patterns")
    class DefaultPatterns {

        @Test
        @DisplayName("should redact password fields and keep the rest")
        void shouldRedactPassword() {
            Map<String, Object> result = redactor.redact(Map.of("email", "ops@ariia.io", "new_password", "s3cr3t"));

            assertThat(result.get("email")).isEqualTo("ops@ariia.io");
            assertThat(result.get("new_password")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should redact access token and csrf cookie values")
        void shouldRedactTokensAndCookies() {
            Map<String, Object> result = redactor.redact(Map.of(
                    "ariia_access_token", "eyJzdWIi...",
                    "Set-Cookie", "ariia_csrf_token=abc",
                    "Authorization", "Bearer eyJ"));

            assertThat(result.values()).containsOnly(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should redact nested maps")
        void shouldRedactNestedMaps() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("reason", "support ticket #42");
            data.put("request", Map.of("password", "hunter2", "target", 17));

            Map<String, Object> result = redactor.redact(data);

            assertThat(result.get("reason")).isEqualTo("support ticket #42");
            @SuppressWarnings("unchecked")
            Map<String, Object> nested = (Map<String, Object>) result.get("request");
            assertThat(nested.get("password")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(nested.get("target")).isEqualTo(17);
        }

        @Test
        @DisplayName("should preserve insertion order")
        void shouldPreserveOrder() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("b", 1);
            data.put("a", 2);
            data.put("secret", 3);

            assertThat(redactor.redact(data).keySet()).containsExactly("b", "a", "secret");
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("null and empty input return an empty map")
        void nullAndEmptyInput() {
            assertThat(redactor.redact(null)).isEmpty();
            assertThat(redactor.redact(Map.of())).isEmpty();
        }

        @Test
        @DisplayName("null field name is not sensitive")
        void nullFieldName() {
            assertThat(redactor.isSensitive(null)).isFalse();
        }

        @Test
        @DisplayName("custom patterns replace the defaults")
        void customPatterns() {
            var custom = new SensitiveDataRedactor(Set.of("reason"));

            assertThat(custom.isSensitive("REASON")).isTrue();
            assertThat(custom.isSensitive("password")).isFalse();
            assertThat(custom.sensitivePatterns()).containsExactly("reason");
        }

        @Test
        @DisplayName("empty pattern set is rejected")
        void emptyPatternsRejected() {
            assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
