package com.classgate.authservice.api.dto;

import java.time.Instant;

/**
 * @param token     bearer token to send as {@code Authorization: Bearer <token>}
 * @param tokenType always "Bearer"
 * @param expiresAt when the token stops being accepted
 */
public record LoginResponse(String token, String tokenType, Instant expiresAt) {}
