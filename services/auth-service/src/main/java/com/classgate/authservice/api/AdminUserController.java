package com.classgate.authservice.api;

import com.classgate.authservice.api.dto.ChangeRoleRequest;
import com.classgate.authservice.api.dto.UserResponse;
import com.classgate.authservice.domain.AuthService;
import com.classgate.security.AuthContext;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative user management. The ADMIN check happens in {@link AuthService}, after the
 * {@link AuthContext} argument has been verified.
 */
@RestController
@RequestMapping("/api/v1/admin/users")
public class AdminUserController {

    private final AuthService authService;

    public AdminUserController(AuthService authService) {
        this.authService = authService;
    }

    // AuthContext comes first so an unauthenticated call is rejected before the body is read.
    @PutMapping("/{id}/role")
    public UserResponse changeRole(
            AuthContext context,
            @PathVariable("id") String id,
            @Valid @RequestBody ChangeRoleRequest request) {
        return UserResponse.from(authService.changeRole(context, id, request.role()));
    }
}
