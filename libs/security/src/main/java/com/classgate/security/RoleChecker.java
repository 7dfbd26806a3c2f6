package com.classgate.security;

/**
 * Role membership predicates over an {@link AuthContext}.
 * <p>
 * Membership is exact: an ADMIN context does not satisfy a check for INSTRUCTOR unless
 * INSTRUCTOR's caller also lists ADMIN.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the context carries exactly the given role.
     */
    public static boolean hasRole(AuthContext context, Role required) {
        return context.role() == required;
    }

    /**
     * Checks if the context carries ANY of the given roles. An empty list admits nobody.
     */
    public static boolean hasAnyRole(AuthContext context, Role... allowed) {
        for (Role role : allowed) {
            if (hasRole(context, role)) {
                return true;
            }
        }
        return false;
    }
}
