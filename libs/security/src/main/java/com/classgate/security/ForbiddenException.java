package com.classgate.security;

import java.util.List;

/**
 * Thrown when an authenticated caller's role is not among the roles a route admits.
 * <p>
 * A RuntimeException like every other access failure: callers do not recover from it, the
 * boundary turns it into a 403.
 */
public class ForbiddenException extends RuntimeException {

    private final Role actualRole;
    private final List<Role> allowedRoles;

    public ForbiddenException(Role actualRole, List<Role> allowedRoles) {
        super("Role %s is not permitted; requires one of %s".formatted(actualRole, allowedRoles));
        this.actualRole = actualRole;
        this.allowedRoles = List.copyOf(allowedRoles);
    }

    public Role actualRole() {
        return actualRole;
    }

    public List<Role> allowedRoles() {
        return allowedRoles;
    }
}
