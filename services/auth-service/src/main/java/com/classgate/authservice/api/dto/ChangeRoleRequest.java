package com.classgate.authservice.api.dto;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code PUT /api/v1/admin/users/{id}/role}. */
public record ChangeRoleRequest(@NotBlank String role) {}
