package com.classgate.authservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.classgate.authservice.domain.DependencyException;
import com.classgate.authservice.domain.DuplicateUserException;
import com.classgate.authservice.domain.InvalidCredentialsException;
import com.classgate.authservice.domain.UserNotFoundException;
import com.classgate.authservice.domain.ValidationException;
import com.classgate.observability.CorrelationContext;
import com.classgate.observability.CorrelationContextHolder;
import com.classgate.observability.SensitiveDataRedactor;
import com.classgate.security.AuthenticationException;
import com.classgate.security.ExpiredTokenException;
import com.classgate.security.ForbiddenException;
import com.classgate.security.InvalidSignatureException;
import com.classgate.security.MalformedTokenException;
import com.classgate.security.MissingTokenException;
import com.classgate.security.Role;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ProblemDetail;

/**
 * Unit tests for {@link GlobalExceptionHandler}, exercised as a plain object.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(new SensitiveDataRedactor());

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps ValidationException to 400 with every error listed")
    void validation() {
        ProblemDetail result = handler.handleValidation(
                new ValidationException(List.of("username must not be blank", "email must be a valid address")));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Validation Error");
        assertThat(result.getProperties()).containsEntry(
                "errors", List.of("username must not be blank", "email must be a valid address"));
    }

    @Test
    @DisplayName("maps DuplicateUserException to 409")
    void duplicate() {
        assertThat(handler.handleDuplicate(new DuplicateUserException()).getStatus()).isEqualTo(409);
    }

    @Test
    @DisplayName("maps every token failure to the same generic 401 with a Bearer challenge")
    void tokenFailuresCollapse() {
        List<ProblemDetail> bodies = Stream.<AuthenticationException>of(
                        new MissingTokenException(),
                        new MalformedTokenException("token could not be parsed"),
                        new InvalidSignatureException("token signature does not match"),
                        new ExpiredTokenException(Instant.parse("2025-03-01T10:00:00Z")))
                .map(ex -> {
                    var response = handler.handleAuthentication(ex);
                    assertThat(response.getStatusCode().value()).isEqualTo(401);
                    assertThat(response.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE)).isEqualTo("Bearer");
                    return response.getBody();
                })
                .toList();

        assertThat(bodies).extracting(ProblemDetail::getDetail).containsOnly("Authentication required");
    }

    @Test
    @DisplayName("maps InvalidCredentialsException to 401 with the shared message")
    void invalidCredentials() {
        var response = handler.handleInvalidCredentials(new InvalidCredentialsException());

        assertThat(response.getStatusCode().value()).isEqualTo(401);
        assertThat(response.getBody().getDetail()).isEqualTo("Invalid email or password");
    }

    @Test
    @DisplayName("maps ForbiddenException to 403 without naming roles")
    void forbidden() {
        ProblemDetail result = handler.handleForbidden(new ForbiddenException(Role.STUDENT, List.of(Role.ADMIN)));

        assertThat(result.getStatus()).isEqualTo(403);
        assertThat(result.getDetail()).isEqualTo("Access denied");
    }

    @Test
    @DisplayName("maps UserNotFoundException to 404")
    void notFound() {
        assertThat(handler.handleNotFound(new UserNotFoundException("u-1")).getStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("maps DependencyException to a retryable 503")
    void dependency() {
        ProblemDetail result = handler.handleDependency(
                new DependencyException("User storage is unavailable", new RuntimeException("down")));

        assertThat(result.getStatus()).isEqualTo(503);
        assertThat(result.getProperties()).containsEntry("retryable", true);
    }

    @Test
    @DisplayName("maps generic Exception to 500 without leaking its message")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("secret internals"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("secret internals");
    }

    @Test
    @DisplayName("error responses carry timestamp and correlation ID")
    void enrichment() {
        CorrelationContextHolder.set(CorrelationContext.anonymous("corr-42"));

        ProblemDetail result = handler.handleDuplicate(new DuplicateUserException());

        assertThat(result.getProperties())
                .containsKey("timestamp")
                .containsEntry("correlationId", "corr-42");
    }
}
