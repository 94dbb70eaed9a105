package com.ariia.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Nested
    @DisplayName("valid headers")
    class ValidHeaders {

        @Test
        @DisplayName("extracts token from 'Bearer xxx' header")
        void extractsToken() {
            assertThat(BearerTokenExtractor.extract("Bearer eyJzdWIiOiIxIn0.c2ln")).contains("eyJzdWIiOiIxIn0.c2ln");
        }

        @Test
        @DisplayName("strips whitespace around the token")
        void handlesExtraWhitespace() {
            assertThat(BearerTokenExtractor.extract("Bearer   my-token  ")).contains("my-token");
        }

        @Test
        @DisplayName("matches the scheme case-insensitively")
        void caseInsensitive() {
            assertThat(BearerTokenExtractor.extract("bearer my-token")).contains("my-token");
        }
    }

    @Nested
    @DisplayName("invalid headers")
    class InvalidHeaders {

        @Test
        @DisplayName("returns empty for null or blank header")
        void nullHeader() {
            assertThat(BearerTokenExtractor.extract(null)).isEmpty();
            assertThat(BearerTokenExtractor.extract("  ")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for another scheme")
        void basicScheme() {
            assertThat(BearerTokenExtractor.extract("Basic dXNlcjpwYXNz")).isEmpty();
            assertThat(BearerTokenExtractor.extract("Bearertoken")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for 'Bearer' with no token")
        void bearerNoToken() {
            assertThat(BearerTokenExtractor.extract("Bearer ")).isEmpty();
            assertThat(BearerTokenExtractor.extract("Bearer")).isEmpty();
        }
    }
}
