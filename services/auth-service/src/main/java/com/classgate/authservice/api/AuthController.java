package com.classgate.authservice.api;

import com.classgate.authservice.api.dto.LoginRequest;
import com.classgate.authservice.api.dto.LoginResponse;
import com.classgate.authservice.api.dto.RegisterRequest;
import com.classgate.authservice.api.dto.RegisterResponse;
import com.classgate.authservice.domain.AuthService;
import com.classgate.authservice.domain.LoginResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public registration and login endpoints.
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public RegisterResponse register(@Valid @RequestBody RegisterRequest request) {
        String userId = authService.register(
                request.username(), request.email(), request.password(), request.role());
        return new RegisterResponse("User registered successfully", userId);
    }

    @PostMapping("/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest request) {
        LoginResult result = authService.login(request.email(), request.password());
        return new LoginResponse(result.token(), "Bearer", result.expiresAt());
    }
}
