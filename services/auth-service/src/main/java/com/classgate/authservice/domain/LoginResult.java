package com.classgate.authservice.domain;

import com.classgate.security.Role;
import java.time.Instant;

/**
 * Outcome of a successful login.
 *
 * @param token     signed bearer token
 * @param expiresAt when the token stops being accepted
 * @param userId    id of the authenticated user
 * @param role      role carried by the token
 */
public record LoginResult(String token, Instant expiresAt, String userId, Role role) {

    @Override
    public String toString() {
        return "LoginResult[token=[REDACTED], expiresAt=" + expiresAt + ", userId=" + userId
                + ", role=" + role + "]";
    }
}
