package com.classgate.authservice.domain;

import com.classgate.security.Role;
import java.util.Optional;

/**
 * Port to durable user storage.
 *
 * <p>Implementations must enforce uniqueness of username and email atomically on {@link
 * #insert(User)}; a pre-insert lookup by the caller is only a fast path. Emails arrive already
 * normalized. Username lookups are case-insensitive.
 *
 * <p>Any method may throw {@link RepositoryUnavailableException} when the store cannot be reached.
 */
public interface UserRepository {

    Optional<User> findById(String id);

    Optional<User> findByEmail(String email);

    Optional<User> findByUsername(String username);

    /**
     * Stores a new user.
     *
     * @return the stored user
     * @throws DuplicateRecordException if the username or email is already taken
     */
    User insert(User user);

    /**
     * Replaces the role of an existing user.
     *
     * @return the updated user, or empty if no user has this id
     */
    Optional<User> updateRole(String id, Role role);

    /**
     * Replaces the password digest of an existing user.
     *
     * @return the updated user, or empty if no user has this id
     */
    Optional<User> updatePasswordHash(String id, String passwordHash);
}
