package com.classgate.authservice.infrastructure.web;

import com.classgate.authservice.domain.DependencyException;
import com.classgate.authservice.domain.DuplicateUserException;
import com.classgate.authservice.domain.InvalidCredentialsException;
import com.classgate.authservice.domain.UserNotFoundException;
import com.classgate.authservice.domain.ValidationException;
import com.classgate.observability.CorrelationContextHolder;
import com.classgate.observability.SensitiveDataRedactor;
import com.classgate.security.AuthenticationException;
import com.classgate.security.ForbiddenException;
import com.classgate.security.InvalidInputException;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>The internal error types are finer than what clients see. Every token failure (missing,
 * malformed, bad signature, expired) becomes the same 401, and both login failures share one
 * message. Responses and log lines never contain passwords, digests, tokens or the signing
 * secret. Every body carries a timestamp and the request's correlation ID.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://classgate.dev/errors/";

    private final SensitiveDataRedactor redactor;

    public GlobalExceptionHandler(SensitiveDataRedactor redactor) {
        this.redactor = redactor;
    }

    @ExceptionHandler(ValidationException.class)
    public ProblemDetail handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation",
                String.join("; ", ex.errors()));
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
        List<FieldError> fieldErrors = ex.getBindingResult().getFieldErrors();
        Map<String, Object> rejected = new LinkedHashMap<>();
        fieldErrors.forEach(fe -> rejected.put(fe.getField(), fe.getRejectedValue()));
        log.warn("Request body rejected: {}", redactor.redact(rejected));

        List<String> errors = fieldErrors.stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation",
                errors.isEmpty() ? "Validation failed" : String.join("; ", errors));
        problem.setProperty("errors", errors);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body");
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request",
                "Request body is missing or malformed");
    }

    @ExceptionHandler(InvalidInputException.class)
    public ProblemDetail handleInvalidInput(InvalidInputException ex) {
        log.warn("Invalid input: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(DuplicateUserException.class)
    public ProblemDetail handleDuplicate(DuplicateUserException ex) {
        log.info("Registration conflict");
        return problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ProblemDetail> handleInvalidCredentials(InvalidCredentialsException ex) {
        return unauthorized(InvalidCredentialsException.MESSAGE);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ProblemDetail> handleAuthentication(AuthenticationException ex) {
        log.info("Request rejected: {}", ex.getClass().getSimpleName());
        return unauthorized("Authentication required");
    }

    @ExceptionHandler(ForbiddenException.class)
    public ProblemDetail handleForbidden(ForbiddenException ex) {
        log.info("Access denied for role {}; requires one of {}", ex.actualRole(), ex.allowedRoles());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", "Access denied");
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ProblemDetail handleNotFound(UserNotFoundException ex) {
        log.info(ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", "User not found");
    }

    @ExceptionHandler(DependencyException.class)
    public ProblemDetail handleDependency(DependencyException ex) {
        log.error("Dependency unavailable", ex);
        ProblemDetail problem = problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "unavailable", "Service temporarily unavailable, please retry");
        problem.setProperty("retryable", true);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Spring MVC's own failures (unknown route, wrong method, ...) keep their status.
            log.warn("Request failed: {}", ex.getMessage());
            ProblemDetail problem = errorResponse.getBody();
            problem.setProperty("timestamp", Instant.now().toString());
            CorrelationContextHolder.get()
                    .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
            return problem;
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ResponseEntity<ProblemDetail> unauthorized(String detail) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", detail));
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
