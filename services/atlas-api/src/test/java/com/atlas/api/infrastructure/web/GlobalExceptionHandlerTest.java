package com.atlas.api.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.atlas.eventmodel.InvalidEventException;
import com.atlas.observability.CorrelationContext;
import com.atlas.observability.CorrelationContextHolder;
import com.atlas.security.AuthException;
import com.atlas.security.AuthFailure;
import com.atlas.security.TenantMismatchException;
import com.atlas.security.webhook.WebhookSignatureException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.server.ResponseStatusException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("authentication")
    class Authentication {

        @Test
        @DisplayName("credential failures are 401 with the generic message and reason")
        void unauthorized() {
            ProblemDetail result = handler.handleAuth(
                    new AuthException(AuthFailure.BAD_SIGNATURE, "signature mismatch for key xyz"));

            assertThat(result.getStatus()).isEqualTo(401);
            assertThat(result.getDetail()).isEqualTo("Invalid token signature");
            assertThat(result.getProperties()).containsEntry("reason", "bad_signature");
        }

        @Test
        @DisplayName("insufficient permissions are 403 with the explanation")
        void forbidden() {
            ProblemDetail result = handler.handleAuth(new AuthException(AuthFailure.INSUFFICIENT_PERMISSIONS,
                    "Insufficient permissions: viewer cannot perform admin actions"));

            assertThat(result.getStatus()).isEqualTo(403);
            assertThat(result.getDetail()).contains("viewer cannot perform admin");
            assertThat(result.getProperties()).containsEntry("reason", "insufficient_permissions");
        }

        @Test
        @DisplayName("webhook signature failures are 401")
        void webhook() {
            ProblemDetail result = handler.handleWebhookSignature(
                    new WebhookSignatureException("github", "Invalid webhook signature"));

            assertThat(result.getStatus()).isEqualTo(401);
            assertThat(result.getProperties()).containsEntry("reason", "signature_verification_failed");
        }
    }

    @Nested
    @DisplayName("tenancy")
    class Tenancy {

        @Test
        @DisplayName("tenant mismatch is 403 without naming the pinned tenant")
        void mismatch() {
            ProblemDetail result = handler.handleTenantMismatch(new TenantMismatchException("acme", "globex"));

            assertThat(result.getStatus()).isEqualTo(403);
            assertThat(result.getDetail()).doesNotContain("acme");
            assertThat(result.getProperties()).containsEntry("reason", "tenant_mismatch");
        }

        @Test
        @DisplayName("missing tenant header is 401")
        void missingTenant() {
            ProblemDetail result = handler.handleMissingTenant(new MissingTenantException());

            assertThat(result.getStatus()).isEqualTo(401);
            assertThat(result.getProperties()).containsEntry("reason", "missing_tenant");
        }
    }

    @Nested
    @DisplayName("bad requests")
    class BadRequests {

        @Test
        @DisplayName("own validation failures are 400 with their message")
        void invalidRequest() {
            ProblemDetail result = handler.handleInvalidRequest(
                    new InvalidRequestException("limit must be between 1 and 100"));

            assertThat(result.getStatus()).isEqualTo(400);
            assertThat(result.getDetail()).isEqualTo("limit must be between 1 and 100");
        }

        @Test
        @DisplayName("incomplete webhook events are 400 naming the missing fields")
        void invalidEvent() {
            ProblemDetail result = handler.handleInvalidRequest(
                    new InvalidEventException(List.of("eventType must not be null or blank")));

            assertThat(result.getStatus()).isEqualTo(400);
            assertThat(result.getDetail()).contains("eventType");
        }

        @Test
        @DisplayName("other IllegalArgumentExceptions are 400 without their message")
        void libraryIllegalArgument() {
            ProblemDetail result = handler.handleBadRequest(
                    new IllegalArgumentException("SQL statement must not be null: select api_key_hash"));

            assertThat(result.getStatus()).isEqualTo(400);
            assertThat(result.getDetail()).isEqualTo("Malformed request");
        }
    }

    @Test
    @DisplayName("unexpected exceptions are 500 without internals")
    void internal() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("SELECT * FROM api_keys failed"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("api_keys");
    }

    @Test
    @DisplayName("framework exceptions keep their own status")
    void frameworkStatus() {
        ProblemDetail result = handler.handleGeneric(new ResponseStatusException(HttpStatus.NOT_FOUND, "API key not found"));

        assertThat(result.getStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("problems carry timestamp and correlation ID")
    void enriched() {
        CorrelationContextHolder.set(CorrelationContext.start("corr-77"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-77");
    }
}
