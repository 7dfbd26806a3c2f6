package com.classgate.authservice.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/v1/auth/register}. Format rules beyond presence are checked by the
 * domain.
 *
 * @param role optional; STUDENT (default) or INSTRUCTOR
 */
public record RegisterRequest(
        @NotBlank String username,
        @NotBlank String email,
        @NotBlank String password,
        String role) {

    @Override
    public String toString() {
        return "RegisterRequest[username=" + username + ", role=" + role + "]";
    }
}
