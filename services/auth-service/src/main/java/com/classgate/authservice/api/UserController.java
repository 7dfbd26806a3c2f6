package com.classgate.authservice.api;

import com.classgate.authservice.api.dto.UserResponse;
import com.classgate.authservice.domain.AuthService;
import com.classgate.security.AuthContext;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints for the authenticated caller. Any role may use them.
 */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final AuthService authService;

    public UserController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/me")
    public UserResponse me(AuthContext context) {
        return UserResponse.from(authService.currentUser(context));
    }
}
