package com.classgate.security;

import java.time.Instant;

/**
 * Claims recovered from a token that passed signature and expiry checks.
 *
 * @param subject   user id the token was issued to
 * @param role      role asserted at issuance
 * @param issuedAt  issuance time (second precision)
 * @param expiresAt expiry time (second precision)
 */
public record TokenClaims(String subject, Role role, Instant issuedAt, Instant expiresAt) {

    /** The request-scoped identity these claims describe. */
    public AuthContext toAuthContext() {
        return new AuthContext(subject, role);
    }
}
