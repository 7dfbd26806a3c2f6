package com.classgate.authservice.domain;

import com.classgate.security.Role;
import java.time.Instant;

/**
 * A registered identity.
 *
 * <p>{@code passwordHash} is an opaque bcrypt digest. It is only ever checked through {@link
 * com.classgate.security.PasswordHasher#verify}, never compared with equals, and {@link
 * #toString()} leaves it out.
 *
 * @param id           unique, immutable user id
 * @param username     unique login handle (uniqueness is case-insensitive)
 * @param email        unique, stored trimmed and lower-cased
 * @param passwordHash bcrypt digest of the password
 * @param role         platform role
 * @param createdAt    registration time
 */
public record User(
        String id,
        String username,
        String email,
        String passwordHash,
        Role role,
        Instant createdAt) {

    public User withRole(Role newRole) {
        return new User(id, username, email, passwordHash, newRole, createdAt);
    }

    public User withPasswordHash(String newPasswordHash) {
        return new User(id, username, email, newPasswordHash, role, createdAt);
    }

    @Override
    public String toString() {
        return "User[id=" + id + ", username=" + username + ", role=" + role
                + ", createdAt=" + createdAt + "]";
    }
}
