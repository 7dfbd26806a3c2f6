package com.classgate.authservice.domain;

import com.classgate.security.AccessControl;
import com.classgate.security.AuthContext;
import com.classgate.security.IssuedToken;
import com.classgate.security.PasswordHasher;
import com.classgate.security.Role;
import com.classgate.security.TokenService;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration, login and the account operations built on them.
 *
 * <p>Every method works only on its own arguments plus collaborators that are immutable after
 * startup, so one instance serves all requests concurrently without locking. Passwords, digests
 * and tokens are never logged.
 */
public final class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository users;
    private final PasswordHasher hasher;
    private final TokenService tokens;
    private final AccessControl accessControl;
    private final RegistrationValidator validator;
    private final Clock clock;

    // Verified against when the email is unknown, so both login failures cost one bcrypt check.
    private final String timingDigest;

    public AuthService(
            UserRepository users,
            PasswordHasher hasher,
            TokenService tokens,
            AccessControl accessControl,
            PasswordPolicy passwordPolicy,
            Clock clock) {
        this.users = users;
        this.hasher = hasher;
        this.tokens = tokens;
        this.accessControl = accessControl;
        this.validator = new RegistrationValidator(passwordPolicy);
        this.clock = clock;
        this.timingDigest = hasher.hash(UUID.randomUUID().toString());
    }

    /**
     * Registers a student.
     *
     * @see #register(String, String, String, String)
     */
    public String register(String username, String email, String password) {
        return register(username, email, password, null);
    }

    /**
     * Registers a new user and returns its id.
     *
     * @param requestedRole STUDENT or INSTRUCTOR, case-insensitive; null or blank means STUDENT
     * @throws ValidationException    if any input breaks a format or password rule
     * @throws DuplicateUserException if the username or email is taken
     * @throws DependencyException    if user storage is unavailable
     */
    public String register(String username, String email, String password, String requestedRole) {
        String normalizedUsername = username == null ? null : username.strip();
        String normalizedEmail = normalizeEmail(email);
        String roleName = requestedRole == null || requestedRole.isBlank() ? null : requestedRole;

        validator.validate(normalizedUsername, normalizedEmail, password, roleName).orThrow();
        Role role = roleName == null ? Role.STUDENT : Role.fromString(roleName).orElseThrow();

        if (repository(() -> users.findByUsername(normalizedUsername)).isPresent()
                || repository(() -> users.findByEmail(normalizedEmail)).isPresent()) {
            throw new DuplicateUserException();
        }

        var user = new User(
                UUID.randomUUID().toString(),
                normalizedUsername,
                normalizedEmail,
                hasher.hash(password),
                role,
                clock.instant());
        try {
            repository(() -> users.insert(user));
        } catch (DuplicateRecordException e) {
            // Lost a race with a concurrent registration; same outcome as the pre-check.
            throw new DuplicateUserException(e);
        }

        log.info("Registered user {} with role {}", user.id(), role);
        return user.id();
    }

    /**
     * Authenticates by email and password and issues a bearer token.
     *
     * @throws InvalidCredentialsException if the email is unknown or the password does not match
     * @throws DependencyException         if user storage is unavailable
     */
    public LoginResult login(String email, String password) {
        String normalizedEmail = normalizeEmail(email);
        Optional<User> found = normalizedEmail.isEmpty()
                ? Optional.empty()
                : repository(() -> users.findByEmail(normalizedEmail));

        if (found.isEmpty()) {
            hasher.verify(password, timingDigest);
            log.debug("Login rejected: unknown email");
            throw new InvalidCredentialsException();
        }

        User user = found.get();
        if (!hasher.verify(password, user.passwordHash())) {
            log.info("Login rejected for user {}: password mismatch", user.id());
            throw new InvalidCredentialsException();
        }

        upgradeHashIfNeeded(user, password);
        IssuedToken token = tokens.issue(user.id(), user.role());
        log.info("User {} logged in", user.id());
        return new LoginResult(token.value(), token.expiresAt(), user.id(), user.role());
    }

    /**
     * Loads the profile of the authenticated caller.
     *
     * @throws UserNotFoundException if the token's subject no longer exists
     */
    public User currentUser(AuthContext context) {
        return repository(() -> users.findById(context.userId()))
                .orElseThrow(() -> new UserNotFoundException(context.userId()));
    }

    /**
     * Changes another user's role. Admin only.
     * <p>
     * Tokens already issued to the target keep their old role until they expire.
     *
     * @throws com.classgate.security.ForbiddenException if the actor is not an ADMIN
     * @throws ValidationException                       if the role name is not recognized
     * @throws UserNotFoundException                     if the target does not exist
     */
    public User changeRole(AuthContext actor, String userId, String roleName) {
        accessControl.requireRole(actor, Role.ADMIN);
        Role role = Role.fromString(roleName).orElseThrow(() -> new ValidationException(
                List.of("role must be one of STUDENT, INSTRUCTOR, ADMIN")));

        User updated = repository(() -> users.updateRole(userId, role))
                .orElseThrow(() -> new UserNotFoundException(userId));
        log.info("User {} changed role of user {} to {}", actor.userId(), userId, role);
        return updated;
    }

    private void upgradeHashIfNeeded(User user, String password) {
        if (!hasher.needsRehash(user.passwordHash())) {
            return;
        }
        try {
            users.updatePasswordHash(user.id(), hasher.hash(password));
            log.info("Upgraded password hash of user {} to work factor {}", user.id(), hasher.workFactor());
        } catch (RepositoryUnavailableException e) {
            log.warn("Could not upgrade password hash of user {}; keeping the old one", user.id(), e);
        }
    }

    private static <T> T repository(Supplier<T> call) {
        try {
            return call.get();
        } catch (RepositoryUnavailableException e) {
            throw new DependencyException("User storage is unavailable", e);
        }
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.strip().toLowerCase(Locale.ROOT);
    }
}
