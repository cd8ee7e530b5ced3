package com.atlas.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atlas.security.testing.TestIdentityFactory;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("CredentialResolver")
class CredentialResolverTest {

    private final TokenCodec codec = TestIdentityFactory.codec(Clock.systemUTC());
    private final InMemoryApiKeyRegistry registry = TestIdentityFactory.registryWithRoleKeys();
    private final CredentialResolver resolver = new CredentialResolver(codec, registry);

    private static AuthFailure failureOf(Runnable call) {
        try {
            call.run();
        } catch (AuthException e) {
            return e.failure();
        }
        throw new AssertionError("Expected AuthException");
    }

    @Nested
    @DisplayName("Bearer scheme")
    class Bearer {

        @Test
        @DisplayName("resolves a valid token")
        void validToken() {
            String token = codec.issue(Identity.of("u1", "alice", "admin"));

            Identity identity = resolver.resolve("Bearer " + token);

            assertThat(identity.username()).isEqualTo("alice");
            assertThat(identity.role()).isEqualTo("admin");
        }

        @Test
        @DisplayName("scheme is case-insensitive")
        void caseInsensitive() {
            String token = codec.issue(TestIdentityFactory.create());

            assertThat(resolver.resolve("bEaReR " + token).username()).isEqualTo("test-user");
        }

        @Test
        @DisplayName("propagates token failures")
        void expired() {
            String token = codec.issue(TestIdentityFactory.create(), Duration.ofSeconds(-10));

            assertThat(failureOf(() -> resolver.resolve("Bearer " + token)))
                    .isEqualTo(AuthFailure.EXPIRED);
        }
    }

    @Nested
    @DisplayName("ApiKey scheme")
    class ApiKey {

        @Test
        @DisplayName("resolves a registered key")
        void registeredKey() {
            assertThat(resolver.resolve("ApiKey auditor-key").role()).isEqualTo("auditor");
        }

        @Test
        @DisplayName("unknown key fails with UNKNOWN_KEY")
        void unknownKey() {
            assertThat(failureOf(() -> resolver.resolve("ApiKey nope")))
                    .isEqualTo(AuthFailure.UNKNOWN_KEY);
        }

        @Test
        @DisplayName("removed key is no longer accepted")
        void removedKey() {
            registry.remove("viewer-key");

            assertThat(failureOf(() -> resolver.resolve("APIKEY viewer-key")))
                    .isEqualTo(AuthFailure.UNKNOWN_KEY);
        }
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("missing header fails with MISSING_CREDENTIAL")
    void missing(String header) {
        assertThat(failureOf(() -> resolver.resolve(header)))
                .isEqualTo(AuthFailure.MISSING_CREDENTIAL);
    }

    @Test
    @DisplayName("header without a space fails with MALFORMED_CREDENTIAL")
    void noSpace() {
        assertThat(failureOf(() -> resolver.resolve("Bearer")))
                .isEqualTo(AuthFailure.MALFORMED_CREDENTIAL);
    }

    @Test
    @DisplayName("unknown scheme fails with UNSUPPORTED_SCHEME")
    void unknownScheme() {
        assertThat(failureOf(() -> resolver.resolve("Basic dXNlcjpwYXNz")))
                .isEqualTo(AuthFailure.UNSUPPORTED_SCHEME);
    }

    @Test
    @DisplayName("failures are never thrown as anything but AuthException")
    void typedFailure() {
        assertThatThrownBy(() -> resolver.resolve("Bearer x.y"))
                .isInstanceOf(AuthException.class)
                .hasMessage(AuthFailure.MALFORMED_TOKEN.defaultMessage());
    }
}
