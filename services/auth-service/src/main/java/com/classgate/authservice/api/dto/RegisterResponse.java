package com.classgate.authservice.api.dto;

public record RegisterResponse(String message, String userId) {}
