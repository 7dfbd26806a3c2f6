package com.classgate.security;

import java.util.Objects;

/**
 * Identity resolved from a verified bearer token for the duration of one request.
 * <p>
 * Produced by {@link AccessControl#authenticate(String)} and handed explicitly to whatever handles
 * the request. It is never stored on a shared object and never outlives the request.
 *
 * @param userId subject of the token (the user's id)
 * @param role   role asserted by the token
 */
public record AuthContext(String userId, Role role) {

    public AuthContext {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        Objects.requireNonNull(role, "role must not be null");
    }
}
