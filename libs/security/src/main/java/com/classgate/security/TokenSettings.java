package com.classgate.security;

import java.time.Duration;

/**
 * Immutable token configuration, built once at startup and handed to {@link TokenService}.
 *
 * @param secret     HMAC signing secret; must be non-blank and should differ per environment
 * @param defaultTtl lifetime of tokens issued without an explicit ttl; must be positive
 * @param issuer     value of the {@code iss} claim (defaults to "classgate")
 */
public record TokenSettings(String secret, Duration defaultTtl, String issuer) {

    public static final String DEFAULT_ISSUER = "classgate";

    public TokenSettings {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("token signing secret must not be blank");
        }
        if (defaultTtl == null) {
            throw new ConfigurationException("token ttl must be configured");
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new ConfigurationException("token ttl must be positive, was " + defaultTtl);
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = DEFAULT_ISSUER;
        }
    }

    /** Never prints the secret. */
    @Override
    public String toString() {
        return "TokenSettings[secret=[REDACTED], defaultTtl=" + defaultTtl + ", issuer=" + issuer + "]";
    }
}
