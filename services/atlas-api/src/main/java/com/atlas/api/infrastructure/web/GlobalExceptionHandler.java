package com.atlas.api.infrastructure.web;

import com.atlas.eventmodel.EventSerializer.EventSerializationException;
import com.atlas.eventmodel.InvalidEventException;
import com.atlas.observability.CorrelationContextHolder;
import com.atlas.security.AuthException;
import com.atlas.security.TenantMismatchException;
import com.atlas.security.webhook.WebhookSignatureException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Authentication problems carry a {@code reason} property with a stable code clients can switch
 * on. Every problem carries {@code timestamp} and {@code correlationId}. Details never include
 * secrets, SQL or stack traces:
 *
 * <pre>
 * {
 *   "type": "https://pipelineatlas.dev/errors/unauthorized",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Token expired",
 *   "reason": "expired",
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String ERROR_TYPE_BASE = "https://pipelineatlas.dev/errors/";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthException.class)
    public ProblemDetail handleAuth(AuthException ex) {
        String reason = ex.failure().reason();
        log.warn("Authentication failed: reason={} detail={}", reason, ex.getMessage());
        if (ex.failure().forbidden()) {
            return problem(HttpStatus.FORBIDDEN, "forbidden", ex.getMessage(), reason);
        }
        return problem(HttpStatus.UNAUTHORIZED, "unauthorized", ex.failure().defaultMessage(), reason);
    }

    @ExceptionHandler(WebhookSignatureException.class)
    public ProblemDetail handleWebhookSignature(WebhookSignatureException ex) {
        log.warn("Rejected {} webhook: {}", ex.platform(), ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "unauthorized", ex.getMessage(), "signature_verification_failed");
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Tenant isolation violation: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "forbidden", "Access to this tenant is not allowed", "tenant_mismatch");
    }

    @ExceptionHandler(MissingTenantException.class)
    public ProblemDetail handleMissingTenant(MissingTenantException ex) {
        return problem(HttpStatus.UNAUTHORIZED, "unauthorized", ex.getMessage(), "missing_tenant");
    }

    @ExceptionHandler({InvalidRequestException.class, InvalidEventException.class})
    public ProblemDetail handleInvalidRequest(RuntimeException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", ex.getMessage(), null);
    }

    @ExceptionHandler({IllegalArgumentException.class, EventSerializationException.class,
            HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Malformed request", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "validation", detail, null);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Framework exceptions (404, 405, missing parameters) already know their status.
            ProblemDetail body = errorResponse.getBody();
            enrich(body);
            return body;
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "An unexpected error occurred", null);
    }

    private static ProblemDetail problem(HttpStatusCode status, String type, String detail, String reason) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        if (reason != null) {
            problem.setProperty("reason", reason);
        }
        enrich(problem);
        return problem;
    }

    private static void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.correlationId()
                .ifPresent(id -> problem.setProperty("correlationId", id));
    }
}
