package com.classgate.security;

import java.time.Instant;

/**
 * Thrown when a correctly signed token is past its expiry.
 */
public class ExpiredTokenException extends AuthenticationException {

    private final Instant expiresAt;

    public ExpiredTokenException(Instant expiresAt) {
        super("Token expired at " + expiresAt);
        this.expiresAt = expiresAt;
    }

    public Instant expiresAt() {
        return expiresAt;
    }
}
