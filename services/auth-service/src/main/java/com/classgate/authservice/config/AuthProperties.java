package com.classgate.authservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe authentication settings, bound once at startup from {@code classgate.auth.*}.
 *
 * <pre>
 * classgate:
 *   auth:
 *     jwt-secret: ${CLASSGATE_JWT_SECRET}
 *     token-ttl: 1h
 *     issuer: classgate
 *     work-factor: 12
 *     password:
 *       min-length: 8
 *       require-letter: true
 *       require-digit: true
 * </pre>
 *
 * <p>A blank secret fails Bean Validation and the application does not start.
 *
 * @param jwtSecret  HMAC secret for signing tokens. Required; must differ per environment.
 * @param tokenTtl   lifetime of issued tokens (default 1h)
 * @param issuer     {@code iss} claim (default "classgate")
 * @param workFactor bcrypt log-rounds, 4..31 (default 12)
 * @param password   password complexity rules
 */
@ConfigurationProperties(prefix = "classgate.auth")
@Validated
public record AuthProperties(
        @NotBlank String jwtSecret,
        Duration tokenTtl,
        String issuer,
        @Min(4) @Max(31) int workFactor,
        @Valid Password password) {

    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(1);
    public static final int DEFAULT_WORK_FACTOR = 12;

    /**
     * Compact constructor: applies defaults before Bean Validation runs.
     */
    public AuthProperties {
        if (tokenTtl == null) {
            tokenTtl = DEFAULT_TOKEN_TTL;
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = "classgate";
        }
        if (workFactor <= 0) {
            workFactor = DEFAULT_WORK_FACTOR;
        }
        if (password == null) {
            password = new Password(0, null, null);
        }
    }

    @Override
    public String toString() {
        return "AuthProperties[jwtSecret=[REDACTED], tokenTtl=" + tokenTtl + ", issuer=" + issuer
                + ", workFactor=" + workFactor + ", password=" + password + "]";
    }

    /**
     * @param minLength     minimum password length (default 8)
     * @param requireLetter require at least one letter (default true)
     * @param requireDigit  require at least one digit (default true)
     */
    public record Password(@Min(1) @Max(72) int minLength, Boolean requireLetter, Boolean requireDigit) {

        public Password {
            if (minLength <= 0) {
                minLength = 8;
            }
            if (requireLetter == null) {
                requireLetter = Boolean.TRUE;
            }
            if (requireDigit == null) {
                requireDigit = Boolean.TRUE;
            }
        }
    }
}
