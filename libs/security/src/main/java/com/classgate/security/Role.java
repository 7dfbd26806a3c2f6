package com.classgate.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Platform roles carried in every token and {@link AuthContext}.
 *
 * <p>Roles are flat: no role implies another. A route that admits both instructors and
 * administrators lists both.
 */
public enum Role {

    STUDENT("Student"),
    INSTRUCTOR("Instructor"),
    ADMIN("Admin");

    private final String displayName;

    Role(String displayName) {
        this.displayName = displayName;
    }

    /** Human-readable name (e.g., "Instructor"). */
    public String displayName() {
        return displayName;
    }

    /**
     * Looks up a Role by name, ignoring case and surrounding whitespace.
     * <p>
     * "student", "Student" and "STUDENT" all resolve to {@link #STUDENT}.
     *
     * @param value the string to match (may be null)
     * @return the matching Role, or empty if not recognized
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toUpperCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether a string corresponds to a known role.
     */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
