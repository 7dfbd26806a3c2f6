package com.classgate.security;

import java.time.Instant;

/**
 * A freshly signed token and the instant it stops being valid.
 *
 * @param value     compact serialization ({@code header.payload.signature})
 * @param expiresAt expiry time (second precision)
 */
public record IssuedToken(String value, Instant expiresAt) {

    /** Tokens are credentials; keep them out of logs. */
    @Override
    public String toString() {
        return "IssuedToken[value=[REDACTED], expiresAt=" + expiresAt + "]";
    }
}
