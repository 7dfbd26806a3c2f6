package com.classgate.authservice.infrastructure.persistence;

import com.classgate.authservice.domain.DuplicateRecordException;
import com.classgate.authservice.domain.User;
import com.classgate.authservice.domain.UserRepository;
import com.classgate.security.Role;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Process-local {@link UserRepository}.
 *
 * <p>Reads are lock-free. Writes take a single lock so that the username and email unique keys
 * are checked and claimed together; two concurrent inserts with the same email cannot both
 * succeed. Contents are lost on restart.
 */
@Repository
public class InMemoryUserRepository implements UserRepository {

    private final Map<String, User> usersById = new ConcurrentHashMap<>();
    private final Map<String, String> idsByEmail = new ConcurrentHashMap<>();
    private final Map<String, String> idsByUsername = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    @Override
    public Optional<User> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(usersById.get(id));
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return lookup(idsByEmail, email);
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return lookup(idsByUsername, username);
    }

    @Override
    public User insert(User user) {
        String emailKey = key(user.email());
        String usernameKey = key(user.username());
        synchronized (writeLock) {
            if (idsByUsername.containsKey(usernameKey)) {
                throw new DuplicateRecordException("username");
            }
            if (idsByEmail.containsKey(emailKey)) {
                throw new DuplicateRecordException("email");
            }
            if (usersById.containsKey(user.id())) {
                throw new DuplicateRecordException("id");
            }
            usersById.put(user.id(), user);
            idsByEmail.put(emailKey, user.id());
            idsByUsername.put(usernameKey, user.id());
        }
        return user;
    }

    @Override
    public Optional<User> updateRole(String id, Role role) {
        synchronized (writeLock) {
            return Optional.ofNullable(usersById.computeIfPresent(id, (k, user) -> user.withRole(role)));
        }
    }

    @Override
    public Optional<User> updatePasswordHash(String id, String passwordHash) {
        synchronized (writeLock) {
            return Optional.ofNullable(
                    usersById.computeIfPresent(id, (k, user) -> user.withPasswordHash(passwordHash)));
        }
    }

    /** Number of stored users. */
    public int size() {
        return usersById.size();
    }

    private Optional<User> lookup(Map<String, String> index, String value) {
        if (value == null) {
            return Optional.empty();
        }
        String id = index.get(key(value));
        return id == null ? Optional.empty() : Optional.ofNullable(usersById.get(id));
    }

    private static String key(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }
}
