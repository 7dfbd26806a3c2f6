package com.classgate.authservice.api.dto;

import com.classgate.authservice.domain.User;
import com.classgate.security.Role;
import java.time.Instant;

/**
 * Client view of a user. Carries no password field.
 */
public record UserResponse(String id, String username, String email, Role role, Instant createdAt) {

    public static UserResponse from(User user) {
        return new UserResponse(user.id(), user.username(), user.email(), user.role(), user.createdAt());
    }
}
