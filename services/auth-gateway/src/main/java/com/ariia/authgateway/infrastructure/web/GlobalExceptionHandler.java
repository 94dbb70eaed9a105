package com.ariia.authgateway.infrastructure.web;

import com.ariia.observability.CorrelationContextHolder;
import com.ariia.security.AuthErrorCode;
import com.ariia.security.AuthException;
import com.ariia.security.TenantMismatchException;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://ariia.app/errors/unauthenticated",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Session invalid, please sign in again",
 *   "timestamp": "2026-03-02T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>For {@link AuthException} only the code's user message reaches the client; the internal
 * detail is logged. Every response carries the correlation ID so support can find the log lines.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://ariia.app/errors/";

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemDetail> handleAuth(AuthException ex) {
        AuthErrorCode.Status statusClass = ex.code().status();
        HttpStatus status = HttpStatus.valueOf(statusClass.httpStatus());
        if (statusClass == AuthErrorCode.Status.UNAUTHENTICATED) {
            log.info("Authentication rejected: {}", ex.getMessage());
        } else {
            log.warn("Auth request refused: {}", ex.getMessage());
        }
        ProblemDetail problem = problem(status, ex.userMessage(),
                statusClass.name().toLowerCase(Locale.ROOT));
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (status == HttpStatus.UNAUTHORIZED) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return response.body(problem);
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Cross-tenant access denied: contextTenantId={}, resourceTenantId={}",
                ex.contextTenantId(), ex.resourceTenantId());
        return problem(HttpStatus.FORBIDDEN, "Cross-tenant access is not allowed", "forbidden");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, detail, "validation");
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Request could not be read", "bad-request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Framework rejections (unknown route, wrong method) keep their own status.
            HttpStatusCode status = errorResponse.getStatusCode();
            ProblemDetail problem = errorResponse.getBody();
            enrichWithCorrelation(problem);
            return ResponseEntity.status(status).body(problem);
        }
        log.error("Internal server error", ex);
        return ResponseEntity.internalServerError()
                .body(problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "internal"));
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    private static void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
